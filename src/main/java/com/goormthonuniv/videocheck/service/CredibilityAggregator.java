package com.goormthonuniv.videocheck.service;

import com.goormthonuniv.videocheck.dto.*;
import com.goormthonuniv.videocheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 세 분석기 신뢰도 → 최종 신뢰 점수/등급/요약.
 * 순수 함수이며, 검증은 경고 목록만 돌려준다(예외 없음).
 */
@Slf4j
@Service
public class CredibilityAggregator {

    // 가중치 합 = 1.0
    public static final double WEIGHT_AI = 0.40;
    public static final double WEIGHT_MANIPULATION = 0.35;
    public static final double WEIGHT_AUTHENTICITY = 0.25;

    public enum CredibilityTier {
        HIGH(80, "HIGH CREDIBILITY",
                "Video appears authentic with minimal signs of manipulation or AI generation."),
        MODERATE(60, "MODERATE CREDIBILITY",
                "Video shows some concerning indicators. Additional verification recommended."),
        LOW(40, "LOW CREDIBILITY",
                "Video shows significant signs of manipulation or AI generation. Use with caution."),
        VERY_LOW(0, "VERY LOW CREDIBILITY",
                "Video likely contains AI-generated content or significant manipulations. Not recommended for use.");

        private final int minScore;
        private final String label;
        private final String sentence;

        CredibilityTier(int minScore, String label, String sentence) {
            this.minScore = minScore;
            this.label = label;
            this.sentence = sentence;
        }

        public String label() { return label; }

        public String recommendation() { return label + ": " + sentence; }

        /** 높은 등급부터 평가 */
        public static CredibilityTier of(int score) {
            for (CredibilityTier t : values()) {
                if (score >= t.minScore) return t;
            }
            return VERY_LOW;
        }
    }

    public VideoAnalysisResult aggregate(AnalyzerResult ai, AnalyzerResult manipulation, AnalyzerResult authenticity) {
        int score = calculateCredibilityScore(ai.confidence(), manipulation.confidence(), authenticity.confidence());
        String recommendation = CredibilityTier.of(score).recommendation();
        String summary = summarize(ai.confidence(), manipulation.confidence(), authenticity.confidence(), score);
        return new VideoAnalysisResult(ai, manipulation, authenticity,
                new OverallVerdict(score, recommendation, summary), authenticityReport(authenticity));
    }

    /** 진위 검증 보고서: 요약 한 줄, 메타데이터 상세, 권고 */
    public AuthenticityReport authenticityReport(AnalyzerResult authenticity) {
        long confidence = Math.round(authenticity.confidence());
        String summary = "Authenticity confidence: " + confidence + "% based on "
                + authenticity.sources().size() + " source(s) analyzed.";

        List<String> details = new ArrayList<>();
        VideoMetadata metadata = authenticity.metadata();
        if (metadata.creationDate() != null) details.add("Creation date: " + metadata.creationDate());
        if (metadata.deviceInfo() != null) details.add("Device information: " + metadata.deviceInfo());
        if (metadata.location() != null) details.add("Location data: " + metadata.location());
        if (!metadata.compressionHistory().isEmpty()) {
            details.add("Compression history: " + String.join(", ", metadata.compressionHistory()));
        }

        List<String> recommendations = new ArrayList<>();
        if (confidence >= 80) {
            recommendations.add("High authenticity confidence - video appears to be from original source");
        } else if (confidence >= 60) {
            recommendations.add("Moderate authenticity - additional verification recommended");
        } else {
            recommendations.add("Low authenticity confidence - exercise caution when using this content");
        }

        long verified = authenticity.sources().stream().filter(AuthenticitySource::verified).count();
        recommendations.add(verified > 0
                ? verified + " verified source(s) found"
                : "No verified sources identified - consider additional verification");

        return new AuthenticityReport(summary, details, recommendations);
    }

    /** AI/조작 신뢰도는 반전(높을수록 신뢰 하락), 진위 신뢰도는 그대로 반영 */
    public int calculateCredibilityScore(double aiConfidence, double manipulationConfidence, double authenticityConfidence) {
        double raw = (100 - aiConfidence) * WEIGHT_AI
                + (100 - manipulationConfidence) * WEIGHT_MANIPULATION
                + authenticityConfidence * WEIGHT_AUTHENTICITY;
        return (int) Math.round(TextUtils.clampScore(raw));
    }

    public String summarize(double aiConfidence, double manipulationConfidence, double authenticityConfidence, int score) {
        List<String> parts = new ArrayList<>();

        if (aiConfidence > 70) {
            parts.add("High likelihood of AI generation (" + Math.round(aiConfidence) + "% confidence)");
        } else if (aiConfidence > 40) {
            parts.add("Moderate signs of AI generation detected");
        } else {
            parts.add("Low likelihood of AI generation");
        }

        if (manipulationConfidence > 70) {
            parts.add("significant video manipulation detected");
        } else if (manipulationConfidence > 40) {
            parts.add("some video editing indicators found");
        } else {
            parts.add("minimal signs of manipulation");
        }

        if (authenticityConfidence > 70) {
            parts.add("strong authenticity indicators present");
        } else if (authenticityConfidence > 40) {
            parts.add("moderate authenticity verification");
        } else {
            parts.add("limited authenticity verification possible");
        }

        return "Analysis complete with " + score + "% credibility score. " + String.join(", ", parts) + ".";
    }

    /** 범위/필수값 검사. 위반은 경고 목록으로만 모은다. */
    public List<String> validate(VideoAnalysisResult results, double durationSeconds) {
        List<String> warnings = new ArrayList<>();

        checkScore(warnings, "AI detection confidence", results.aiGenerated().confidence());
        checkScore(warnings, "Manipulation detection confidence", results.manipulation().confidence());
        checkScore(warnings, "Authenticity verification confidence", results.authenticity().confidence());
        checkScore(warnings, "Overall credibility score", results.overall().credibilityScore());

        for (AnalyzerResult r : List.of(results.aiGenerated(), results.manipulation(), results.authenticity())) {
            r.indicators().forEach((key, value) -> checkScore(warnings, "Indicator " + key, value));
        }

        for (TimelineAnomaly a : results.manipulation().anomalies()) {
            if (a.timestamp() < 0) {
                warnings.add("Timeline anomaly has invalid timestamp: " + a.timestamp());
            } else if (durationSeconds > 0 && a.timestamp() > durationSeconds) {
                warnings.add("Timeline anomaly timestamp " + a.timestamp()
                        + "s exceeds video duration " + durationSeconds + "s");
            }
            if (a.duration() <= 0) {
                warnings.add("Timeline anomaly has invalid duration: " + a.duration());
            }
            if (outOfRange(a.confidence())) {
                warnings.add("Timeline anomaly has invalid confidence score: " + a.confidence());
            }
        }

        for (AuthenticitySource s : results.authenticity().sources()) {
            if (outOfRange(s.similarity())) {
                warnings.add("Authenticity source has invalid similarity score: " + s.similarity());
            }
            if (s.source() == null || s.source().isBlank()) {
                warnings.add("Authenticity source name is missing");
            }
        }

        requireText(warnings, "AI detection explanation", results.aiGenerated().explanation());
        requireText(warnings, "Manipulation detection explanation", results.manipulation().explanation());
        requireText(warnings, "Authenticity verification explanation", results.authenticity().explanation());
        requireText(warnings, "Overall recommendation", results.overall().recommendation());
        requireText(warnings, "Overall summary", results.overall().summary());

        if (!warnings.isEmpty()) {
            log.warn("Analysis results validation failed: {}", warnings);
        }
        return warnings;
    }

    private static void checkScore(List<String> warnings, String field, double value) {
        if (outOfRange(value)) {
            warnings.add(field + " is out of valid range (0-100): " + value);
        }
    }

    private static boolean outOfRange(double v) {
        return Double.isNaN(v) || v < 0 || v > 100;
    }

    private static void requireText(List<String> warnings, String field, String value) {
        if (value == null || value.isBlank()) {
            warnings.add(field + " is missing");
        }
    }
}
