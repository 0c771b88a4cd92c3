package com.goormthonuniv.videocheck.dto;

public record AnalysisStatusResponse(
        String analysisId,
        String status,           // processing | completed | failed
        int progress,            // 0~100
        String stage,
        String message
) {}
