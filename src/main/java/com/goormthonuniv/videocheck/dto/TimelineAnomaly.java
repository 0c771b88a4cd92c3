package com.goormthonuniv.videocheck.dto;

public record TimelineAnomaly(
        double timestamp,        // 초 단위 시작 위치 (>= 0)
        double duration,         // 초 단위 길이 (> 0)
        AnomalyType type,
        double confidence,       // 0~100
        String description
) {
    public double end() {
        return timestamp + duration;
    }
}
