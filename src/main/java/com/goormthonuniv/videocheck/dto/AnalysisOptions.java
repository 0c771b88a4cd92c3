package com.goormthonuniv.videocheck.dto;

public record AnalysisOptions(
        long timeoutMs,       // 시도 1회당 타임아웃
        int retryAttempts     // 첫 실패 이후 추가 시도 횟수
) {
    public AnalysisOptions {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must not be negative: " + retryAttempts);
        }
    }
}
