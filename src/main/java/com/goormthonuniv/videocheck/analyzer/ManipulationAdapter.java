package com.goormthonuniv.videocheck.analyzer;

import com.goormthonuniv.videocheck.dto.AnalyzerKind;
import com.goormthonuniv.videocheck.dto.AnalyzerResult;
import com.goormthonuniv.videocheck.dto.TimelineAnomaly;
import com.goormthonuniv.videocheck.llm.InferenceProvider;
import com.goormthonuniv.videocheck.verify.ResponseParser;
import com.goormthonuniv.videocheck.verify.TimelineAnomalyMerger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

@Component
public class ManipulationAdapter extends AbstractAnalyzerAdapter {

    public ManipulationAdapter(InferenceProvider provider,
                               @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
        super(provider, inferenceExecutor);
    }

    @Override public AnalyzerKind kind() { return AnalyzerKind.MANIPULATION; }

    @Override
    protected Map<String, String> prompts() {
        return Prompt.VARIANTS;
    }

    @Override
    protected AnalyzerResult parse(String response, AnalysisRequest request) {
        return ResponseParser.parseManipulation(response, request.durationHintSeconds());
    }

    @Override
    protected AnalyzerResult combine(double confidence, Map<String, Double> indicators,
                                     String explanation, List<AnalyzerResult> variants) {
        List<TimelineAnomaly> all = variants.stream()
                .flatMap(v -> v.anomalies().stream())
                .toList();
        return new AnalyzerResult(kind(), confidence, explanation, indicators,
                List.of(), TimelineAnomalyMerger.merge(all), List.of(), null);
    }

    static class Prompt {
        static final Map<String, String> VARIANTS;

        static {
            Map<String, String> variants = new LinkedHashMap<>();
            variants.put("temporal", """
                    Analyze this video for temporal manipulation and editing. Look for:
                    1. Sudden cuts or transitions between frames
                    2. Temporal inconsistencies in motion or lighting
                    3. Frame rate changes or dropped frames
                    4. Inconsistent compression between segments
                    5. Audio-video synchronization issues
                    6. Timeline gaps or jumps

                    Identify specific timestamps (MM:SS) where anomalies occur and rate confidence (0-100) for each detection.
                    """);
            variants.put("spatial", """
                    Examine this video for spatial manipulation and object editing. Focus on:
                    1. Object insertion, removal, or replacement
                    2. Background changes or compositing
                    3. Scale or perspective inconsistencies
                    4. Edge artifacts around modified objects
                    5. Color or lighting mismatches
                    6. Unnatural object interactions

                    Mark regions and timestamps (MM:SS) of detected manipulations with confidence scores (0-100).
                    """);
            variants.put("quality", """
                    Detect quality-based manipulation indicators in this video:
                    1. Inconsistent resolution or sharpness across the frame
                    2. Compression artifacts in specific regions
                    3. Noise patterns that don't match the source
                    4. Upscaling or enhancement artifacts
                    5. Format conversion indicators
                    6. Re-encoding signatures

                    Provide timestamps (MM:SS) and confidence levels (0-100) for quality anomalies detected.
                    """);
            VARIANTS = Collections.unmodifiableMap(variants);
        }
    }
}
