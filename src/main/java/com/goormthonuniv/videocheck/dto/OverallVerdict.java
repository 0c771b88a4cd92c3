package com.goormthonuniv.videocheck.dto;

public record OverallVerdict(
        int credibilityScore,    // 0~100 (항상 존재)
        String recommendation,   // "HIGH CREDIBILITY: ..." 등
        String summary           // 점수 + 세 분석기 정성 요약 한 문장
) {}
