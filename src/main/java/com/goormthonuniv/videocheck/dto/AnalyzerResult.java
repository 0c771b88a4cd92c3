package com.goormthonuniv.videocheck.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 분석기 하나(또는 프롬프트 variant 하나)의 결과.
 * 종류별 필드(techniques / anomalies / sources, metadata)는 해당 종류가 아니면 비어 있다.
 */
public record AnalyzerResult(
        @JsonIgnore AnalyzerKind kind,
        double confidence,                  // 0~100
        String explanation,
        Map<String, Double> indicators,     // 종류별 고정 키, 값 0~100
        List<String> techniques,            // AI 생성 탐지
        List<TimelineAnomaly> anomalies,    // 조작 탐지
        List<AuthenticitySource> sources,   // 진위 검증
        VideoMetadata metadata              // 진위 검증
) {
    public AnalyzerResult {
        indicators = indicators == null ? Map.of() : unmodifiableOrdered(indicators);
        techniques = techniques == null ? List.of() : List.copyOf(techniques);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        sources = sources == null ? List.of() : List.copyOf(sources);
        metadata = metadata == null ? VideoMetadata.empty() : metadata;
    }

    /** 분석 실패/미요청 시 대체 결과: 신뢰도 0, 지표 전부 0 */
    public static AnalyzerResult defaulted(AnalyzerKind kind, String explanation) {
        Map<String, Double> zeros = new LinkedHashMap<>();
        for (String key : IndicatorKeys.of(kind)) {
            zeros.put(key, 0.0);
        }
        return new AnalyzerResult(kind, 0, explanation, zeros, List.of(), List.of(), List.of(), VideoMetadata.empty());
    }

    private static Map<String, Double> unmodifiableOrdered(Map<String, Double> in) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
}
