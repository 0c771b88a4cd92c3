package com.goormthonuniv.videocheck.dto;

import java.util.List;

public record AnalysisEstimateResponse(
        long sizeBytes,
        double durationSeconds,
        List<String> analysisTypes,
        long estimatedSeconds
) {}
