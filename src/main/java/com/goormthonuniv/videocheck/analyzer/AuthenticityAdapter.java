package com.goormthonuniv.videocheck.analyzer;

import com.goormthonuniv.videocheck.dto.AnalyzerKind;
import com.goormthonuniv.videocheck.dto.AnalyzerResult;
import com.goormthonuniv.videocheck.dto.AuthenticitySource;
import com.goormthonuniv.videocheck.dto.VideoMetadata;
import com.goormthonuniv.videocheck.llm.InferenceProvider;
import com.goormthonuniv.videocheck.verify.ResponseParser;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.Executor;
import java.util.function.Function;

@Component
public class AuthenticityAdapter extends AbstractAnalyzerAdapter {

    public AuthenticityAdapter(InferenceProvider provider,
                               @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
        super(provider, inferenceExecutor);
    }

    @Override public AnalyzerKind kind() { return AnalyzerKind.AUTHENTICITY; }

    @Override
    protected Map<String, String> prompts() {
        return Prompt.VARIANTS;
    }

    @Override
    protected AnalyzerResult parse(String response, AnalysisRequest request) {
        return ResponseParser.parseAuthenticity(response);
    }

    @Override
    protected AnalyzerResult combine(double confidence, Map<String, Double> indicators,
                                     String explanation, List<AnalyzerResult> variants) {
        List<AuthenticitySource> sources = deduplicateSources(
                variants.stream().flatMap(v -> v.sources().stream()).toList());
        return new AnalyzerResult(kind(), confidence, explanation, indicators,
                List.of(), List.of(), sources, mergeMetadata(variants));
    }

    /** 출처명(소문자) 기준 중복 제거, 유사도 높은 쪽 유지, 유사도 내림차순 */
    static List<AuthenticitySource> deduplicateSources(List<AuthenticitySource> sources) {
        Map<String, AuthenticitySource> byName = new LinkedHashMap<>();
        for (AuthenticitySource s : sources) {
            String key = s.source().toLowerCase(Locale.ROOT);
            AuthenticitySource existing = byName.get(key);
            if (existing == null || s.similarity() > existing.similarity()) {
                byName.put(key, s);
            }
        }
        return byName.values().stream()
                .sorted(Comparator.comparingDouble(AuthenticitySource::similarity).reversed())
                .toList();
    }

    /** 필드별 첫 값, 압축 이력은 순서 유지 합집합 */
    static VideoMetadata mergeMetadata(List<AnalyzerResult> variants) {
        LinkedHashSet<String> history = new LinkedHashSet<>();
        variants.forEach(v -> history.addAll(v.metadata().compressionHistory()));
        return new VideoMetadata(
                firstPresent(variants, VideoMetadata::creationDate),
                firstPresent(variants, VideoMetadata::deviceInfo),
                firstPresent(variants, VideoMetadata::location),
                List.copyOf(history));
    }

    private static String firstPresent(List<AnalyzerResult> variants, Function<VideoMetadata, String> field) {
        return variants.stream()
                .map(v -> field.apply(v.metadata()))
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    static class Prompt {
        static final Map<String, String> VARIANTS;

        static {
            Map<String, String> variants = new LinkedHashMap<>();
            variants.put("metadata", """
                    Analyze this video's metadata and technical characteristics for authenticity markers:
                    1. Compression patterns and encoding signatures
                    2. Creation timestamp consistency
                    3. Device fingerprints and camera characteristics
                    4. File format and container analysis
                    5. Embedded metadata integrity
                    6. Technical fingerprints that indicate original source

                    Assess the likelihood (confidence 0-100) that this video is from an original, unmodified source.
                    """);
            variants.put("contextual", """
                    Examine this video for contextual authenticity indicators:
                    1. Environmental consistency (lighting, shadows, reflections)
                    2. Physical plausibility of events and interactions
                    3. Temporal consistency of elements in the scene
                    4. Audio-visual coherence and natural synchronization
                    5. Realistic human behavior and expressions
                    6. Consistent perspective and camera movement

                    Evaluate (confidence 0-100) whether the content appears to be authentic and unmanipulated.
                    """);
            variants.put("source", """
                    Analyze this video for source verification markers:
                    1. Watermarks, logos, or identifying elements
                    2. Broadcasting or platform-specific characteristics
                    3. Professional vs amateur production indicators
                    4. Equipment signatures (camera, microphone, editing software)
                    5. Distribution chain indicators
                    6. Compression history and re-encoding patterns

                    Determine the likelihood (confidence 0-100) of authentic source material and original provenance.
                    """);
            VARIANTS = Collections.unmodifiableMap(variants);
        }
    }
}
