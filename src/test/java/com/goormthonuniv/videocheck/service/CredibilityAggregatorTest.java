package com.goormthonuniv.videocheck.service;

import com.goormthonuniv.videocheck.dto.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CredibilityAggregator 단위 테스트
 */
class CredibilityAggregatorTest {

    private final CredibilityAggregator aggregator = new CredibilityAggregator();

    private static AnalyzerResult result(AnalyzerKind kind, double confidence) {
        return new AnalyzerResult(kind, confidence, kind.displayName() + " explanation",
                Map.of(), List.of(), List.of(), List.of(), null);
    }

    @Test
    @DisplayName("가중 점수: (80, 70, 20) → 24, VERY LOW")
    void weightedScore() {
        // when
        VideoAnalysisResult r = aggregator.aggregate(
                result(AnalyzerKind.AI_DETECTION, 80),
                result(AnalyzerKind.MANIPULATION, 70),
                result(AnalyzerKind.AUTHENTICITY, 20));

        // then
        assertThat(r.overall().credibilityScore()).isEqualTo(24);
        assertThat(r.overall().recommendation()).startsWith("VERY LOW CREDIBILITY:");
        assertThat(r.overall().summary()).startsWith("Analysis complete with 24% credibility score. ");
        assertThat(r.overall().summary()).contains("High likelihood of AI generation (80% confidence)");
    }

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "100, HIGH",
            "80, HIGH",
            "79, MODERATE",
            "60, MODERATE",
            "59, LOW",
            "40, LOW",
            "39, VERY_LOW",
            "0, VERY_LOW"
    })
    @DisplayName("등급 경계")
    void tierBoundaries(int score, CredibilityAggregator.CredibilityTier expected) {
        assertThat(CredibilityAggregator.CredibilityTier.of(score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("모든 입력이 기본값(0)이면 점수 75")
    void allDefaulted() {
        assertThat(aggregator.calculateCredibilityScore(0, 0, 0)).isEqualTo(75);
        assertThat(aggregator.calculateCredibilityScore(100, 100, 100)).isEqualTo(25);
        assertThat(aggregator.calculateCredibilityScore(0, 0, 100)).isEqualTo(100);
    }

    @Test
    @DisplayName("요약 문구는 구간별로 달라진다")
    void summaryBands() {
        String summary = aggregator.summarize(50, 10, 90, 70);
        assertThat(summary).isEqualTo("Analysis complete with 70% credibility score. "
                + "Moderate signs of AI generation detected, minimal signs of manipulation, "
                + "strong authenticity indicators present.");
    }

    @Test
    @DisplayName("정상 결과는 경고 없음")
    void validResultHasNoWarnings() {
        VideoAnalysisResult r = aggregator.aggregate(
                AnalyzerResult.defaulted(AnalyzerKind.AI_DETECTION, "AI Detection analysis failed: x"),
                result(AnalyzerKind.MANIPULATION, 30),
                result(AnalyzerKind.AUTHENTICITY, 70));

        assertThat(aggregator.validate(r, 60)).isEmpty();
    }

    @Test
    @DisplayName("범위 밖 값과 빈 설명은 경고로만 보고")
    void validateCollectsWarnings() {
        AnalyzerResult badManipulation = new AnalyzerResult(AnalyzerKind.MANIPULATION, 120, "",
                Map.of("frame_cuts", -5.0), List.of(),
                List.of(new TimelineAnomaly(-1, 0, AnomalyType.CUT, 50, "bad")),
                List.of(), null);
        VideoAnalysisResult r = new VideoAnalysisResult(
                result(AnalyzerKind.AI_DETECTION, 10),
                badManipulation,
                result(AnalyzerKind.AUTHENTICITY, 10),
                new OverallVerdict(50, "MODERATE CREDIBILITY: x", "summary"),
                aggregator.authenticityReport(result(AnalyzerKind.AUTHENTICITY, 10)));

        List<String> warnings = aggregator.validate(r, 60);

        assertThat(warnings).contains(
                "Manipulation detection confidence is out of valid range (0-100): 120.0",
                "Indicator frame_cuts is out of valid range (0-100): -5.0",
                "Timeline anomaly has invalid timestamp: -1.0",
                "Timeline anomaly has invalid duration: 0.0",
                "Manipulation detection explanation is missing");
    }

    @Test
    @DisplayName("영상 길이를 넘어선 이상 구간은 경고")
    void anomalyBeyondDurationWarns() {
        // given: 60초 영상에 75초 지점 이상 구간
        AnalyzerResult manipulation = new AnalyzerResult(AnalyzerKind.MANIPULATION, 40, "edited",
                Map.of(), List.of(),
                List.of(new TimelineAnomaly(12, 2, AnomalyType.CUT, 60, "ok"),
                        new TimelineAnomaly(75, 2, AnomalyType.INSERTION, 60, "late")),
                List.of(), null);
        VideoAnalysisResult r = aggregator.aggregate(
                result(AnalyzerKind.AI_DETECTION, 10), manipulation, result(AnalyzerKind.AUTHENTICITY, 70));

        // when
        List<String> warnings = aggregator.validate(r, 60);

        // then
        assertThat(warnings).containsExactly("Timeline anomaly timestamp 75.0s exceeds video duration 60.0s");
        assertThat(aggregator.validate(r, 90)).isEmpty();
    }

    @Test
    @DisplayName("진위 보고서: 메타데이터 상세와 검증 출처 수")
    void authenticityReportWithMetadata() {
        // given
        AnalyzerResult authenticity = new AnalyzerResult(AnalyzerKind.AUTHENTICITY, 85, "original",
                Map.of(), List.of(), List.of(),
                List.of(new AuthenticitySource(null, 90, "News Media", true),
                        new AuthenticitySource(null, 70, "YouTube", false)),
                new VideoMetadata("2024-03-01", "iPhone 14", null, List.of("H264", "MP4")));

        // when
        AuthenticityReport report = aggregator.authenticityReport(authenticity);

        // then
        assertThat(report.summary()).isEqualTo("Authenticity confidence: 85% based on 2 source(s) analyzed.");
        assertThat(report.details()).containsExactly(
                "Creation date: 2024-03-01",
                "Device information: iPhone 14",
                "Compression history: H264, MP4");
        assertThat(report.recommendations()).containsExactly(
                "High authenticity confidence - video appears to be from original source",
                "1 verified source(s) found");
    }

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "80, High authenticity confidence - video appears to be from original source",
            "79, Moderate authenticity - additional verification recommended",
            "60, Moderate authenticity - additional verification recommended",
            "59, Low authenticity confidence - exercise caution when using this content"
    })
    @DisplayName("진위 보고서 권고 구간, 출처 없으면 추가 검증 권고")
    void authenticityReportBands(int confidence, String expected) {
        AuthenticityReport report = aggregator.authenticityReport(result(AnalyzerKind.AUTHENTICITY, confidence));

        assertThat(report.summary()).endsWith("based on 0 source(s) analyzed.");
        assertThat(report.details()).isEmpty();
        assertThat(report.recommendations()).containsExactly(expected,
                "No verified sources identified - consider additional verification");
    }

    @Test
    @DisplayName("집계 결과에 진위 보고서가 포함된다")
    void aggregateIncludesAuthenticityReport() {
        VideoAnalysisResult r = aggregator.aggregate(
                result(AnalyzerKind.AI_DETECTION, 10),
                result(AnalyzerKind.MANIPULATION, 10),
                result(AnalyzerKind.AUTHENTICITY, 65));

        assertThat(r.authenticityReport().summary())
                .isEqualTo("Authenticity confidence: 65% based on 0 source(s) analyzed.");
    }
}
