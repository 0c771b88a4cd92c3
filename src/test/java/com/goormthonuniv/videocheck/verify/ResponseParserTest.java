package com.goormthonuniv.videocheck.verify;

import com.goormthonuniv.videocheck.dto.AnalyzerResult;
import com.goormthonuniv.videocheck.dto.AnomalyType;
import com.goormthonuniv.videocheck.dto.AuthenticitySource;
import com.goormthonuniv.videocheck.dto.TimelineAnomaly;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.goormthonuniv.videocheck.dto.IndicatorKeys.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * ResponseParser 단위 테스트
 */
class ResponseParserTest {

    @Nested
    @DisplayName("신뢰도 추출")
    class Confidence {

        @Test
        @DisplayName("'confidence: 85%' 형식")
        void labelFirst() {
            assertThat(ResponseParser.extractConfidence("Overall confidence: 85% that this is synthetic")).isEqualTo(85);
        }

        @Test
        @DisplayName("'72% confidence' 형식")
        void suffixForm() {
            assertThat(ResponseParser.extractConfidence("I would say 72% confidence here")).isEqualTo(72);
        }

        @Test
        @DisplayName("두 형식이 모두 있으면 'confidence: N' 이 우선")
        void labelWinsOverSuffix() {
            assertThat(ResponseParser.extractConfidence("90% confidence overall, but confidence: 40 for faces"))
                    .isEqualTo(40);
        }

        @Test
        @DisplayName("100 초과는 100 으로 자른다")
        void clampsAboveHundred() {
            assertThat(ResponseParser.extractConfidence("confidence: 150")).isEqualTo(100);
        }

        @Test
        @DisplayName("숫자가 없거나 빈 응답이면 0")
        void defaultsToZero() {
            assertThat(ResponseParser.extractConfidence("no numbers at all")).isZero();
            assertThat(ResponseParser.extractConfidence("")).isZero();
            assertThat(ResponseParser.extractConfidence(null)).isZero();
        }

        @Test
        @DisplayName("AI 탐지는 'score: N' 도 허용, 조작 탐지는 허용하지 않음")
        void scoreFallbackOnlyForAiDetection() {
            assertThat(ResponseParser.parseAiDetection("AI score: 66").confidence()).isEqualTo(66);
            assertThat(ResponseParser.parseManipulation("AI score: 66", 60).confidence()).isZero();
        }

        @Test
        @DisplayName("진위 검증은 '80% authentic' 과 'authenticity: N' 을 허용")
        void authenticityFallbacks() {
            assertThat(ResponseParser.parseAuthenticity("The clip looks 80% authentic").confidence()).isEqualTo(80);
            assertThat(ResponseParser.parseAuthenticity("authenticity: 55").confidence()).isEqualTo(55);
        }
    }

    @Nested
    @DisplayName("조작 탐지 파싱")
    class Manipulation {

        @Test
        @DisplayName("MM:SS 타임스탬프 주변에 cut 이 있으면 cut 이상 구간")
        void cutAtTimestamp() {
            // when
            AnalyzerResult r = ResponseParser.parseManipulation("confidence: 85% ... cut detected at 1:05", 120);

            // then
            assertThat(r.confidence()).isEqualTo(85);
            assertThat(r.anomalies()).hasSize(1);
            TimelineAnomaly a = r.anomalies().get(0);
            assertThat(a.timestamp()).isEqualTo(65.0);
            assertThat(a.duration()).isEqualTo(1.0);
            assertThat(a.type()).isEqualTo(AnomalyType.CUT);
            assertThat(a.confidence()).isBetween(75.0, 95.0);
            assertThat(r.indicators().get(FRAME_CUTS)).isEqualTo(100.0);
        }

        @Test
        @DisplayName("영상 길이를 넘는 타임스탬프는 버린다")
        void dropsTimestampsBeyondDuration() {
            AnalyzerResult r = ResponseParser.parseManipulation("confidence: 85% ... cut detected at 1:05", 60);

            // 타임스탬프가 없고 신뢰도 > 50 → floor(85/25)=3 개 합성
            assertThat(r.anomalies()).hasSize(3);
            assertThat(r.anomalies()).allSatisfy(a -> {
                assertThat(a.duration()).isEqualTo(2.0);
                assertThat(a.type()).isEqualTo(AnomalyType.TEMPORAL_INCONSISTENCY);
                assertThat(a.description()).isEqualTo("General manipulation indicator detected");
            });
            assertThat(r.anomalies()).extracting(TimelineAnomaly::timestamp).containsExactly(15.0, 30.0, 45.0);
        }

        @Test
        @DisplayName("키워드 계열별 유형 분류")
        void classifiesByKeywordFamily() {
            String text = """
                    confidence: 60
                    An object was removed from the table at 0:10.
                    ..............................................................................................................
                    ..............................................................................................................
                    The audio drifts out of sync around 42 seconds.
                    """;

            AnalyzerResult r = ResponseParser.parseManipulation(text, 60);

            assertThat(r.anomalies()).extracting(TimelineAnomaly::timestamp).containsExactly(10.0, 42.0);
            assertThat(r.anomalies().get(0).type()).isEqualTo(AnomalyType.INSERTION);
            assertThat(r.anomalies().get(0).description()).isEqualTo("Object manipulation detected");
            assertThat(r.anomalies().get(1).type()).isEqualTo(AnomalyType.TEMPORAL_INCONSISTENCY);
            assertThat(r.anomalies().get(1).description()).isEqualTo("Audio-video sync issue detected");
            assertThat(r.indicators().get(OBJECT_INSERTION)).isEqualTo(50.0);
            assertThat(r.indicators().get(AUDIO_SYNC_ISSUES)).isEqualTo(50.0);
            assertThat(r.indicators().get(FRAME_CUTS)).isZero();
        }

        @Test
        @DisplayName("타임스탬프 없고 신뢰도 50 이하면 이상 구간 없음")
        void noSynthesisAtLowConfidence() {
            AnalyzerResult r = ResponseParser.parseManipulation("confidence: 50. Nothing obvious.", 60);
            assertThat(r.anomalies()).isEmpty();
        }
    }

    @Nested
    @DisplayName("AI 탐지 파싱")
    class AiDetection {

        @Test
        @DisplayName("키워드가 없는 지표는 0, 있는 지표는 신뢰도 근처")
        void indicatorsFollowKeywords() {
            AnalyzerResult r = ResponseParser.parseAiDetection(
                    "confidence: 70. Facial geometry is off and lighting is unnatural.");

            assertThat(r.indicators()).containsOnlyKeys(
                    FACIAL_INCONSISTENCIES, TEMPORAL_ARTIFACTS, LIGHTING_ANOMALIES, COMPRESSION_ARTIFACTS);
            assertThat(r.indicators().get(FACIAL_INCONSISTENCIES)).isBetween(60.0, 80.0);
            assertThat(r.indicators().get(LIGHTING_ANOMALIES)).isBetween(63.0, 77.0);
            assertThat(r.indicators().get(TEMPORAL_ARTIFACTS)).isZero();
            assertThat(r.indicators().get(COMPRESSION_ARTIFACTS)).isZero();
        }

        @Test
        @DisplayName("같은 응답은 항상 같은 지표를 낸다")
        void indicatorsAreDeterministic() {
            String text = "confidence: 70. Facial flicker with compression artifacts.";
            assertThat(ResponseParser.parseAiDetection(text).indicators())
                    .isEqualTo(ResponseParser.parseAiDetection(text).indicators());
        }

        @Test
        @DisplayName("기법 어휘는 대소문자 무시 포함 검사")
        void extractsTechniques() {
            AnalyzerResult r = ResponseParser.parseAiDetection("Likely a DEEPFAKE built with Face Swap and GANs");
            assertThat(r.techniques()).containsExactly("deepfake", "face swap", "GANs");
        }
    }

    @Nested
    @DisplayName("진위 검증 파싱")
    class Authenticity {

        @Test
        @DisplayName("플랫폼 언급 → 출처, 사전 정의된 verified 값")
        void detectsPlatforms() {
            AnalyzerResult r = ResponseParser.parseAuthenticity(
                    "confidence: 60. This appears to be a YouTube re-upload of a news broadcast.");

            assertThat(r.sources()).extracting(AuthenticitySource::source).containsExactly("YouTube", "News Media");
            assertThat(r.sources()).extracting(AuthenticitySource::verified).containsExactly(false, true);
            assertThat(r.sources()).allSatisfy(s -> assertThat(s.similarity()).isBetween(50.0, 70.0));
        }

        @Test
        @DisplayName("플랫폼이 없고 신뢰도 > 30 이면 Unknown Source 하나")
        void unknownSourceFallback() {
            AnalyzerResult r = ResponseParser.parseAuthenticity("confidence: 45. Nothing identifiable.");

            assertThat(r.sources()).hasSize(1);
            assertThat(r.sources().get(0).source()).isEqualTo("Unknown Source");
            assertThat(r.sources().get(0).similarity()).isEqualTo(45.0);
            assertThat(r.sources().get(0).verified()).isFalse();
        }

        @Test
        @DisplayName("단어 경계: 'signal' 은 Instagram 으로 보지 않는다")
        void wordBoundedPlatformMatch() {
            AnalyzerResult r = ResponseParser.parseAuthenticity("confidence: 20. Weak signal quality.");
            assertThat(r.sources()).isEmpty();
        }

        @Test
        @DisplayName("메타데이터 추출")
        void extractsMetadata() {
            AnalyzerResult r = ResponseParser.parseAuthenticity("""
                    confidence: 75
                    Created: 2023-04-12
                    Camera: iPhone 13 Pro
                    Location: Seoul, Korea
                    The file was transcoded to H264 inside an MP4 container.
                    """);

            assertThat(r.metadata().creationDate()).isEqualTo("2023-04-12");
            assertThat(r.metadata().deviceInfo()).isEqualTo("iPhone 13 Pro");
            assertThat(r.metadata().location()).isEqualTo("Seoul, Korea");
            assertThat(r.metadata().compressionHistory()).containsExactly("H264", "MP4", "TRANSCODED");
        }
    }

    @Test
    @DisplayName("jitter 는 진폭 안에 있고 결정적이다")
    void jitterIsBoundedAndDeterministic() {
        double a = ResponseParser.jitter("some response", "facial", 10);
        double b = ResponseParser.jitter("some response", "facial", 10);

        assertThat(a).isEqualTo(b);
        assertThat(a).isBetween(-10.0, 10.0);
        assertThat(ResponseParser.jitter("x", "y", 0)).isZero();
    }

    @Test
    @DisplayName("타임스탬프 추출: 두 형식 모두, 등장 순서 유지")
    void extractsBothTimestampForms() {
        List<ResponseParser.TimestampMatch> stamps =
                ResponseParser.extractTimestamps("first at 00:30, then after 12.5 seconds", 60);

        assertThat(stamps).extracting(ResponseParser.TimestampMatch::seconds)
                .containsExactly(30.0, 12.5);
        assertThat(stamps.get(1).seconds()).isCloseTo(12.5, within(1e-9));
    }
}
