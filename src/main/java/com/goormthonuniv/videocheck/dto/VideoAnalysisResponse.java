package com.goormthonuniv.videocheck.dto;

public record VideoAnalysisResponse(
        boolean success,
        String analysisId,
        VideoAnalysisResult results,
        long processingTime      // ms
) {}
