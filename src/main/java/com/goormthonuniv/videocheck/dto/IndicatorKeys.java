package com.goormthonuniv.videocheck.dto;

import java.util.List;

public final class IndicatorKeys {

    // AI 생성 탐지
    public static final String FACIAL_INCONSISTENCIES = "facial_inconsistencies";
    public static final String TEMPORAL_ARTIFACTS = "temporal_artifacts";
    public static final String LIGHTING_ANOMALIES = "lighting_anomalies";
    public static final String COMPRESSION_ARTIFACTS = "compression_artifacts";

    // 조작 탐지
    public static final String FRAME_CUTS = "frame_cuts";
    public static final String OBJECT_INSERTION = "object_insertion";
    public static final String BACKGROUND_CHANGES = "background_changes";
    public static final String AUDIO_SYNC_ISSUES = "audio_sync_issues";

    // 진위 검증
    public static final String METADATA_INTEGRITY = "metadata_integrity";
    public static final String ENVIRONMENTAL_CONSISTENCY = "environmental_consistency";
    public static final String AUDIO_VISUAL_COHERENCE = "audio_visual_coherence";
    public static final String SOURCE_PROVENANCE = "source_provenance";

    private IndicatorKeys() {}

    public static List<String> of(AnalyzerKind kind) {
        return switch (kind) {
            case AI_DETECTION -> List.of(FACIAL_INCONSISTENCIES, TEMPORAL_ARTIFACTS, LIGHTING_ANOMALIES, COMPRESSION_ARTIFACTS);
            case MANIPULATION -> List.of(FRAME_CUTS, OBJECT_INSERTION, BACKGROUND_CHANGES, AUDIO_SYNC_ISSUES);
            case AUTHENTICITY -> List.of(METADATA_INTEGRITY, ENVIRONMENTAL_CONSISTENCY, AUDIO_VISUAL_COHERENCE, SOURCE_PROVENANCE);
        };
    }
}
