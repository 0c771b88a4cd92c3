package com.goormthonuniv.videocheck.verify;

import com.goormthonuniv.videocheck.dto.AnalyzerKind;
import com.goormthonuniv.videocheck.dto.AnalyzerResult;
import com.goormthonuniv.videocheck.dto.AnomalyType;
import com.goormthonuniv.videocheck.dto.AuthenticitySource;
import com.goormthonuniv.videocheck.dto.TimelineAnomaly;
import com.goormthonuniv.videocheck.dto.VideoMetadata;
import com.goormthonuniv.videocheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.goormthonuniv.videocheck.dto.IndicatorKeys.*;

/**
 * 추론 응답(자유 텍스트) → 신뢰도/지표/타임라인/출처 추출.
 *
 * 정규식 기반의 확률적 휴리스틱이다. 어떤 입력에도 예외를 던지지 않으며,
 * 내부 오류 시 경고 로그 후 0/빈 값으로 돌려준다.
 * 같은 텍스트는 항상 같은 결과를 낸다 (지터는 텍스트로 시드된 의사난수).
 */
@Slf4j
public final class ResponseParser {

    // ===== 신뢰도 =====
    private static final Pattern CONFIDENCE_LABEL = ci("confidence[:\\s]*(\\d+)%?");
    private static final Pattern CONFIDENCE_SUFFIX = ci("(\\d+)%?\\s*confidence");
    static final Pattern SCORE_LABEL = ci("score[:\\s]*(\\d+)");
    static final Pattern AUTHENTIC_SUFFIX = ci("(\\d+)%?\\s*(?:authentic|genuine|original)");
    static final Pattern AUTHENTICITY_LABEL = ci("authenticity[:\\s]*(\\d+)%?");

    // ===== 타임스탬프: MM:SS 또는 N(.N) seconds =====
    private static final Pattern TIMESTAMP = ci("\\b(\\d{1,3}):([0-5]\\d)\\b|\\b(\\d+(?:\\.\\d+)?)\\s*(?:seconds?|secs?|s)\\b");
    static final int CONTEXT_RADIUS = 100;
    static final double DETECTED_ANOMALY_DURATION = 1.0;
    static final double SYNTHETIC_ANOMALY_DURATION = 2.0;
    static final double ANOMALY_JITTER = 10;

    // ===== 진위 메타데이터 =====
    private static final Pattern CREATION_DATE = ci("(?:created?|date)[:\\s]*([0-9]{4}[-/][0-9]{1,2}[-/][0-9]{1,2})");
    private static final Pattern DEVICE = ci("(?:device|camera|phone)[:\\s]*([^\\n\\r.]+)");
    private static final Pattern LOCATION = ci("(?:location|gps|coordinates)[:\\s]*([^\\n\\r.]+)");
    private static final int MAX_METADATA_LEN = 200;
    private static final List<String> COMPRESSION_VOCABULARY = List.of(
            "h264", "h265", "mp4", "avi", "mov", "webm", "compressed", "encoded", "transcoded");

    static final List<String> TECHNIQUE_VOCABULARY = List.of(
            "deepfake", "face swap", "voice synthesis", "style transfer",
            "GANs", "neural network", "AI generation", "synthetic media",
            "face replacement", "digital manipulation", "artificial generation");

    /** 키워드 계열 → 지표. 계열이 언급되면 신뢰도 ± 지터, 없으면 0 */
    public record IndicatorRule(String key, double jitter, List<String> keywords) {}

    static final List<IndicatorRule> AI_INDICATOR_RULES = List.of(
            new IndicatorRule(FACIAL_INCONSISTENCIES, 10, List.of("facial", "face")),
            new IndicatorRule(TEMPORAL_ARTIFACTS, 7, List.of("temporal", "flicker")),
            new IndicatorRule(LIGHTING_ANOMALIES, 7, List.of("lighting", "shadow")),
            new IndicatorRule(COMPRESSION_ARTIFACTS, 5, List.of("compression", "artifact")));

    static final List<IndicatorRule> AUTHENTICITY_INDICATOR_RULES = List.of(
            new IndicatorRule(METADATA_INTEGRITY, 7, List.of("metadata", "encoding", "codec")),
            new IndicatorRule(ENVIRONMENTAL_CONSISTENCY, 7, List.of("lighting", "shadow", "reflection", "environment")),
            new IndicatorRule(AUDIO_VISUAL_COHERENCE, 5, List.of("audio", "synchron")),
            new IndicatorRule(SOURCE_PROVENANCE, 10, List.of("watermark", "provenance", "logo", "source")));

    public record TimestampMatch(double seconds, int start, int end) {}

    private static final SourcePlatformPolicy PLATFORMS = new SourcePlatformPolicy();

    private ResponseParser() {}

    // ===================== 종류별 파싱 =====================

    public static AnalyzerResult parseAiDetection(String response) {
        String text = TextUtils.safe(response);
        try {
            double confidence = extractConfidence(text, SCORE_LABEL);
            return new AnalyzerResult(AnalyzerKind.AI_DETECTION, confidence, text,
                    scoreIndicators(text, confidence, AI_INDICATOR_RULES),
                    extractTechniques(text), List.of(), List.of(), null);
        } catch (RuntimeException e) {
            log.warn("Failed to parse AI detection response: {}", e.getMessage());
            return zeroed(AnalyzerKind.AI_DETECTION, text);
        }
    }

    public static AnalyzerResult parseManipulation(String response, double durationHintSeconds) {
        String text = TextUtils.safe(response);
        try {
            double confidence = extractConfidence(text);
            List<TimestampMatch> stamps = extractTimestamps(text, durationHintSeconds);

            List<TimelineAnomaly> anomalies = new ArrayList<>();
            Map<String, Integer> familyHits = new LinkedHashMap<>();
            for (String key : List.of(FRAME_CUTS, OBJECT_INSERTION, BACKGROUND_CHANGES, AUDIO_SYNC_ISSUES)) {
                familyHits.put(key, 0);
            }

            for (TimestampMatch m : stamps) {
                String context = TextUtils.normalize(TextUtils.window(text, m.start(), m.end(), CONTEXT_RADIUS));
                Classification c = classify(context);
                if (c.indicatorKey() != null) {
                    familyHits.merge(c.indicatorKey(), 1, Integer::sum);
                }
                double anomalyConfidence = TextUtils.clampScore(
                        confidence + jitter(text, "anomaly@" + m.start(), ANOMALY_JITTER));
                anomalies.add(new TimelineAnomaly(m.seconds(), DETECTED_ANOMALY_DURATION, c.type(),
                        anomalyConfidence, c.description()));
            }

            // 타임스탬프 없이 높은 신뢰도만 나온 경우: 빈 타임라인 대신 균등 분포 표시
            if (anomalies.isEmpty() && confidence > 50) {
                anomalies.addAll(synthesizeAnomalies(confidence, durationHintSeconds));
            }

            Map<String, Double> indicators = new LinkedHashMap<>();
            int total = stamps.size();
            familyHits.forEach((key, hits) ->
                    indicators.put(key, total == 0 ? 0.0 : TextUtils.clampScore(hits * 100.0 / total)));

            return new AnalyzerResult(AnalyzerKind.MANIPULATION, confidence, text, indicators,
                    List.of(), anomalies, List.of(), null);
        } catch (RuntimeException e) {
            log.warn("Failed to parse manipulation detection response: {}", e.getMessage());
            return zeroed(AnalyzerKind.MANIPULATION, text);
        }
    }

    public static AnalyzerResult parseAuthenticity(String response) {
        String text = TextUtils.safe(response);
        try {
            double confidence = extractConfidence(text, AUTHENTIC_SUFFIX, AUTHENTICITY_LABEL);

            List<AuthenticitySource> sources = new ArrayList<>();
            for (SourcePlatformPolicy.Platform p : PLATFORMS.detect(text)) {
                double similarity = TextUtils.clampScore(confidence + jitter(text, "source:" + p.name(), 10));
                sources.add(new AuthenticitySource(null, similarity, p.name(), p.verified()));
            }
            if (sources.isEmpty() && confidence > 30) {
                sources.add(new AuthenticitySource(null, confidence, "Unknown Source", false));
            }

            return new AnalyzerResult(AnalyzerKind.AUTHENTICITY, confidence, text,
                    scoreIndicators(text, confidence, AUTHENTICITY_INDICATOR_RULES),
                    List.of(), List.of(), sources, extractMetadata(text));
        } catch (RuntimeException e) {
            log.warn("Failed to parse authenticity response: {}", e.getMessage());
            return zeroed(AnalyzerKind.AUTHENTICITY, text);
        }
    }

    // ===================== 공통 추출 =====================

    /**
     * "confidence: 85%" 또는 "85% confidence" (앞 패턴 우선), 없으면 fallbacks 순서대로.
     * 0~100 으로 자르고, 아무것도 없으면 0.
     */
    public static double extractConfidence(String text, Pattern... fallbacks) {
        if (text == null || text.isBlank()) return 0;
        List<Pattern> patterns = new ArrayList<>(List.of(CONFIDENCE_LABEL, CONFIDENCE_SUFFIX));
        patterns.addAll(Arrays.asList(fallbacks));
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                return TextUtils.clampScore(parseNumber(m.group(1)));
            }
        }
        return 0;
    }

    /** MM:SS / N seconds 를 초로 변환. maxSeconds 초과는 버린다. 등장 순서 유지. */
    public static List<TimestampMatch> extractTimestamps(String text, double maxSeconds) {
        if (text == null || text.isBlank()) return List.of();
        List<TimestampMatch> out = new ArrayList<>();
        Matcher m = TIMESTAMP.matcher(text);
        while (m.find()) {
            double seconds;
            if (m.group(1) != null) {
                seconds = parseNumber(m.group(1)) * 60 + parseNumber(m.group(2));
            } else {
                seconds = parseNumber(m.group(3));
            }
            if (seconds <= maxSeconds) {
                out.add(new TimestampMatch(seconds, m.start(), m.end()));
            }
        }
        return out;
    }

    public static Map<String, Double> scoreIndicators(String text, double confidence, List<IndicatorRule> rules) {
        String normalized = TextUtils.normalize(text);
        Map<String, Double> out = new LinkedHashMap<>();
        for (IndicatorRule rule : rules) {
            boolean hit = TextUtils.containsAny(normalized, rule.keywords().toArray(String[]::new));
            out.put(rule.key(), hit
                    ? TextUtils.clampScore(confidence + jitter(text, rule.key(), rule.jitter()))
                    : 0.0);
        }
        return out;
    }

    public static List<String> extractTechniques(String text) {
        String normalized = TextUtils.normalize(text);
        List<String> out = new ArrayList<>();
        for (String keyword : TECHNIQUE_VOCABULARY) {
            if (normalized.contains(keyword.toLowerCase(Locale.ROOT))) {
                out.add(keyword);
            }
        }
        return out;
    }

    public static VideoMetadata extractMetadata(String text) {
        String creationDate = firstGroup(CREATION_DATE, text);
        String device = firstGroup(DEVICE, text);
        String location = firstGroup(LOCATION, text);

        List<String> compression = new ArrayList<>();
        for (String keyword : COMPRESSION_VOCABULARY) {
            Pattern p = Pattern.compile("\\b" + keyword + "\\b", Pattern.CASE_INSENSITIVE);
            if (p.matcher(text).find()) {
                compression.add(keyword.toUpperCase(Locale.ROOT));
            }
        }
        return new VideoMetadata(creationDate, device, location, compression);
    }

    /**
     * [-amplitude, +amplitude) 범위의 결정적 오프셋.
     * 시드 = 응답 텍스트 + salt 이므로 같은 응답은 항상 같은 값을 낸다.
     */
    static double jitter(String text, String salt, double amplitude) {
        if (amplitude <= 0) return 0;
        long seed = 31L * TextUtils.safe(text).hashCode() + TextUtils.safe(salt).hashCode();
        return new Random(seed).nextDouble() * 2 * amplitude - amplitude;
    }

    // ===================== 내부 유틸 =====================

    private record Classification(AnomalyType type, String description, String indicatorKey) {}

    private static Classification classify(String context) {
        if (TextUtils.containsAny(context, "cut", "transition")) {
            return new Classification(AnomalyType.CUT, "Frame cut or transition detected", FRAME_CUTS);
        }
        if (TextUtils.containsAny(context, "object", "insertion", "removal")) {
            return new Classification(AnomalyType.INSERTION, "Object manipulation detected", OBJECT_INSERTION);
        }
        if (TextUtils.containsAny(context, "background", "composit")) {
            return new Classification(AnomalyType.INSERTION, "Background change detected", BACKGROUND_CHANGES);
        }
        if (TextUtils.containsAny(context, "audio", "sync")) {
            return new Classification(AnomalyType.TEMPORAL_INCONSISTENCY, "Audio-video sync issue detected", AUDIO_SYNC_ISSUES);
        }
        return new Classification(AnomalyType.TEMPORAL_INCONSISTENCY, "Temporal anomaly detected", null);
    }

    private static List<TimelineAnomaly> synthesizeAnomalies(double confidence, double durationSeconds) {
        int n = (int) Math.floor(confidence / 25);
        List<TimelineAnomaly> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new TimelineAnomaly(
                    durationSeconds / (n + 1) * (i + 1),
                    SYNTHETIC_ANOMALY_DURATION,
                    AnomalyType.TEMPORAL_INCONSISTENCY,
                    confidence,
                    "General manipulation indicator detected"));
        }
        return out;
    }

    private static AnalyzerResult zeroed(AnalyzerKind kind, String text) {
        return AnalyzerResult.defaulted(kind, text);
    }

    private static String firstGroup(Pattern p, String text) {
        Matcher m = p.matcher(text);
        if (!m.find()) return null;
        String v = m.group(1).trim();
        if (v.isEmpty()) return null;
        return v.length() > MAX_METADATA_LEN ? v.substring(0, MAX_METADATA_LEN) : v;
    }

    private static double parseNumber(String s) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
