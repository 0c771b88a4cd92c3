package com.goormthonuniv.videocheck.analyzer;

import com.goormthonuniv.videocheck.dto.AnalyzerResult;
import com.goormthonuniv.videocheck.dto.IndicatorKeys;
import com.goormthonuniv.videocheck.exception.AnalyzerFailureException;
import com.goormthonuniv.videocheck.llm.InferenceException;
import com.goormthonuniv.videocheck.llm.InferenceProvider;
import com.goormthonuniv.videocheck.util.ExceptionUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * variant 호출 → 파싱 → 접기(fold) 공통 흐름.
 * 하위 클래스는 프롬프트, 응답 파싱, 종류별 목록 병합만 정의한다.
 */
@Slf4j
public abstract class AbstractAnalyzerAdapter implements AnalyzerAdapter {

    private final InferenceProvider provider;
    private final Executor inferenceExecutor;

    protected AbstractAnalyzerAdapter(InferenceProvider provider, Executor inferenceExecutor) {
        this.provider = provider;
        this.inferenceExecutor = inferenceExecutor;
    }

    /** variant 이름 → 프롬프트 (순서 유지) */
    protected abstract Map<String, String> prompts();

    protected abstract AnalyzerResult parse(String response, AnalysisRequest request);

    /** 공통 값(평균 신뢰도/지표, 설명)에 종류별 목록을 합쳐 최종 결과를 만든다 */
    protected abstract AnalyzerResult combine(double confidence,
                                              Map<String, Double> indicators,
                                              String explanation,
                                              List<AnalyzerResult> variants);

    record VariantOutcome(String variant, AnalyzerResult result, String error) {
        boolean succeeded() { return result != null; }
    }

    @Override
    public CompletableFuture<AnalyzerResult> analyze(AnalysisRequest request) {
        List<CompletableFuture<VariantOutcome>> futures = new ArrayList<>();
        List<Future<?>> submitted = new ArrayList<>();
        prompts().forEach((variant, prompt) -> futures.add(submit(variant, prompt, request, submitted)));

        // 전부 기다린 뒤 성공한 것만 접는다 (하나 실패가 나머지를 취소하지 않음)
        CompletableFuture<AnalyzerResult> result = CompletableFuture
                .allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> fold(futures.stream().map(CompletableFuture::join).toList()));

        // 호출자가 취소하면(시도 타임아웃) 대기 중인 호출은 빼고, 실행 중인 호출은 인터럽트
        result.whenComplete((r, ex) -> {
            if (result.isCancelled()) {
                submitted.forEach(task -> task.cancel(true));
                futures.forEach(f -> f.cancel(false));
                log.debug("[{}] attempt cancelled, {} variant calls released", kind().wireName(), submitted.size());
            }
        });
        return result;
    }

    private CompletableFuture<VariantOutcome> submit(String variant, String prompt, AnalysisRequest request,
                                                     List<Future<?>> submitted) {
        CompletableFuture<VariantOutcome> outcome = new CompletableFuture<>();
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                outcome.complete(new VariantOutcome(variant, callVariant(prompt, request), null));
            } catch (RuntimeException e) {
                outcome.complete(new VariantOutcome(variant, null, ExceptionUtils.rootMessage(e)));
            }
        }, null);
        try {
            inferenceExecutor.execute(task);
            submitted.add(task);
        } catch (RejectedExecutionException e) {
            outcome.complete(new VariantOutcome(variant, null, "rejected by executor: " + e.getMessage()));
        }
        return outcome;
    }

    private AnalyzerResult callVariant(String prompt, AnalysisRequest request) {
        String response = provider.invoke(prompt, request.media(), request.mimeType());
        if (response == null || response.isBlank()) {
            throw new InferenceException(provider.name() + " returned an empty response");
        }
        return parse(response, request);
    }

    AnalyzerResult fold(List<VariantOutcome> outcomes) {
        List<String> failures = new ArrayList<>();
        List<VariantOutcome> succeeded = new ArrayList<>();
        for (VariantOutcome o : outcomes) {
            if (o.succeeded()) {
                succeeded.add(o);
            } else {
                failures.add(o.variant() + ": " + o.error());
                log.warn("[{}] variant={} failed: {}", kind().wireName(), o.variant(), o.error());
            }
        }
        if (succeeded.isEmpty()) {
            throw new AnalyzerFailureException(kind(),
                    "All " + kind().displayName() + " variants failed (" + String.join("; ", failures) + ")");
        }

        List<AnalyzerResult> results = succeeded.stream().map(VariantOutcome::result).toList();

        double confidence = Math.round(results.stream()
                .mapToDouble(AnalyzerResult::confidence).average().orElse(0));

        Map<String, Double> indicators = new LinkedHashMap<>();
        for (String key : IndicatorKeys.of(kind())) {
            indicators.put(key, results.stream()
                    .mapToDouble(r -> r.indicators().getOrDefault(key, 0.0))
                    .average().orElse(0));
        }

        StringBuilder explanation = new StringBuilder("Combined ")
                .append(kind().displayName()).append(" Analysis:");
        for (int i = 0; i < succeeded.size(); i++) {
            VariantOutcome o = succeeded.get(i);
            explanation.append("\n\nAnalysis ").append(i + 1)
                    .append(" (").append(o.variant()).append("): ")
                    .append(o.result().explanation());
        }

        log.debug("[{}] folded {} of {} variants, confidence={}",
                kind().wireName(), succeeded.size(), outcomes.size(), confidence);
        return combine(confidence, indicators, explanation.toString(), results);
    }
}
