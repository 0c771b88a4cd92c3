package com.goormthonuniv.videocheck.analyzer;

import com.goormthonuniv.videocheck.dto.AnalyzerKind;
import com.goormthonuniv.videocheck.dto.AnalyzerResult;
import com.goormthonuniv.videocheck.llm.InferenceProvider;
import com.goormthonuniv.videocheck.verify.ResponseParser;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

@Component
public class AiDetectionAdapter extends AbstractAnalyzerAdapter {

    public AiDetectionAdapter(InferenceProvider provider,
                              @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
        super(provider, inferenceExecutor);
    }

    @Override public AnalyzerKind kind() { return AnalyzerKind.AI_DETECTION; }

    @Override
    protected Map<String, String> prompts() {
        return Prompt.VARIANTS;
    }

    @Override
    protected AnalyzerResult parse(String response, AnalysisRequest request) {
        return ResponseParser.parseAiDetection(response);
    }

    @Override
    protected AnalyzerResult combine(double confidence, Map<String, Double> indicators,
                                     String explanation, List<AnalyzerResult> variants) {
        // 기법은 정확한 문자열 기준 합집합, 처음 나온 순서 유지
        LinkedHashSet<String> techniques = new LinkedHashSet<>();
        variants.forEach(v -> techniques.addAll(v.techniques()));
        return new AnalyzerResult(kind(), confidence, explanation, indicators,
                List.copyOf(techniques), List.of(), List.of(), null);
    }

    static class Prompt {
        static final Map<String, String> VARIANTS;

        static {
            Map<String, String> variants = new LinkedHashMap<>();
            variants.put("deepfake", """
                    Analyze this video for signs of deepfake or AI-generated content. Look specifically for:
                    1. Facial inconsistencies (unnatural eye movements, lip sync issues, facial geometry problems)
                    2. Temporal artifacts (flickering, sudden quality changes, frame inconsistencies)
                    3. Lighting anomalies (inconsistent shadows, unnatural lighting on faces)
                    4. Compression artifacts typical of AI generation
                    5. Unnatural movements or gestures
                    6. Background-foreground inconsistencies

                    Provide a confidence score (0-100) where 100 means definitely AI-generated, and list specific techniques detected.
                    """);
            variants.put("synthetic", """
                    Examine this video for synthetic media indicators. Focus on:
                    1. Digital artifacts from AI generation processes
                    2. Unnatural textures or surfaces
                    3. Inconsistent physics or motion
                    4. Repetitive patterns typical of AI models
                    5. Quality inconsistencies between different parts of the frame
                    6. Temporal coherence issues

                    Rate the likelihood of synthetic generation as "Confidence: N%" and explain your findings.
                    """);
            variants.put("manipulation", """
                    Detect AI-assisted video manipulation in this content. Look for:
                    1. Face swapping or replacement indicators
                    2. Voice synthesis markers
                    3. Object insertion or removal using AI tools
                    4. Style transfer or filter applications
                    5. Resolution or quality enhancement artifacts
                    6. Background replacement or modification

                    Assess the confidence level (0-100) and identify specific AI manipulation techniques used.
                    """);
            VARIANTS = Collections.unmodifiableMap(variants);
        }
    }
}
