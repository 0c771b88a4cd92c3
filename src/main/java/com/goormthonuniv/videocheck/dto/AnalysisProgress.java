package com.goormthonuniv.videocheck.dto;

public record AnalysisProgress(
        String stage,       // "initialization" | "ai-detection" | ... | "aggregation" | "completed" | "failed"
        int progress,       // 0~100
        String message
) {}
