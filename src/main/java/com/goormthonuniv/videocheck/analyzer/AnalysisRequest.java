package com.goormthonuniv.videocheck.analyzer;

public record AnalysisRequest(
        byte[] media,                 // 영상 원본 바이트
        String mimeType,              // "video/mp4" ...
        double durationHintSeconds    // 타임스탬프 상한 / 합성 이상구간 배치 기준
) {}
