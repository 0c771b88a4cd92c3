package com.goormthonuniv.videocheck.service;

import com.goormthonuniv.videocheck.analyzer.AnalysisRequest;
import com.goormthonuniv.videocheck.analyzer.AnalyzerAdapter;
import com.goormthonuniv.videocheck.config.AnalysisConfig;
import com.goormthonuniv.videocheck.dto.*;
import com.goormthonuniv.videocheck.exception.AllAnalyzersFailedException;
import com.goormthonuniv.videocheck.exception.AnalyzerFailureException;
import com.goormthonuniv.videocheck.llm.InferenceProvider;
import com.goormthonuniv.videocheck.util.ExceptionUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

@Slf4j
@Service
public class AnalysisOrchestrator {

    // ===== 의존성 =====
    private final Map<AnalyzerKind, AnalyzerAdapter> adapters = new EnumMap<>(AnalyzerKind.class);
    private final CredibilityAggregator aggregator;
    private final InferenceProvider provider;
    private final AnalysisConfig config;
    private final Executor analysisExecutor;
    private final Executor progressExecutor;

    public AnalysisOrchestrator(List<AnalyzerAdapter> adapters,
                                CredibilityAggregator aggregator,
                                InferenceProvider provider,
                                AnalysisConfig config,
                                @Qualifier("analysisExecutor") Executor analysisExecutor,
                                @Qualifier("progressExecutor") Executor progressExecutor) {
        for (AnalyzerAdapter a : adapters) {
            this.adapters.put(a.kind(), a);
        }
        this.aggregator = aggregator;
        this.provider = provider;
        this.config = config;
        this.analysisExecutor = analysisExecutor;
        this.progressExecutor = progressExecutor;
    }

    /** 기본 MIME 타입, 진행률 콜백 없음 */
    public VideoAnalysisResult runAnalysis(byte[] media, double durationHintSeconds,
                                           Set<AnalyzerKind> requestedKinds, AnalysisOptions options) {
        return runAnalysis(media, config.getDefaultMimeType(), durationHintSeconds, requestedKinds, options, null);
    }

    /**
     * 메인 엔트리.
     * 요청된 분석기 중 하나라도 성공하면 세 섹션이 모두 채워진 결과를 돌려주고,
     * 전부 실패했을 때만 {@link AllAnalyzersFailedException} 을 던진다.
     */
    public VideoAnalysisResult runAnalysis(byte[] media, String mimeType, double durationHintSeconds,
                                           Set<AnalyzerKind> requestedKinds, AnalysisOptions options,
                                           Consumer<AnalysisProgress> onProgress) {
        // 1) 입력 정규화
        final Set<AnalyzerKind> kinds = (requestedKinds == null || requestedKinds.isEmpty())
                ? EnumSet.allOf(AnalyzerKind.class)
                : EnumSet.copyOf(requestedKinds);
        final AnalysisOptions opts = options != null ? options : defaultOptions();
        final double duration = durationHintSeconds > 0 ? durationHintSeconds : config.getDefaultDurationSeconds();
        final String mime = (mimeType == null || mimeType.isBlank()) ? config.getDefaultMimeType() : mimeType;
        final AnalysisRequest request = new AnalysisRequest(media, mime, duration);

        // 분석기 수 + 집계 1단계
        ProgressReporter progress = new ProgressReporter(onProgress, progressExecutor, kinds.size() + 1);

        AnalysisState state = AnalysisState.INITIALIZING;
        log.info("Video analysis started: kinds={}, bytes={}, duration={}s, timeoutMs={}, retries={}",
                kinds, media == null ? 0 : media.length, duration, opts.timeoutMs(), opts.retryAttempts());
        progress.report("initialization", "Starting video analysis...");

        // 2) 분석기 병렬 실행 (전부 기다림, 실패는 결과로 수집)
        state = transition(state, AnalysisState.RUNNING_ANALYZERS);
        Map<AnalyzerKind, CompletableFuture<AnalyzerOutcome>> tasks = new EnumMap<>(AnalyzerKind.class);
        for (AnalyzerKind kind : kinds) {
            tasks.put(kind, runAnalyzer(kind, request, opts, progress));
        }
        CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0])).join();

        Map<AnalyzerKind, AnalyzerOutcome> outcomes = new EnumMap<>(AnalyzerKind.class);
        List<String> failures = new ArrayList<>();
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            CompletableFuture<AnalyzerOutcome> task = tasks.get(kind);
            AnalyzerOutcome outcome = task != null
                    ? task.join()
                    : AnalyzerOutcome.Defaulted.of(kind, kind.displayName() + " analysis not requested");
            outcomes.put(kind, outcome);
            if (task != null && outcome instanceof AnalyzerOutcome.Defaulted d) {
                failures.add(d.reason());
            }
        }

        // 3) 전부 실패 → 종료
        if (failures.size() == kinds.size()) {
            transition(state, AnalysisState.FAILED);
            progress.report("failed", "Video analysis failed");
            log.error("All analyses failed: {}", failures);
            throw new AllAnalyzersFailedException(failures);
        }

        // 4) 집계 + 검증(경고만)
        state = transition(state, AnalysisState.AGGREGATING);
        progress.report("aggregation", "Aggregating analysis results...");
        VideoAnalysisResult result = aggregator.aggregate(
                outcomes.get(AnalyzerKind.AI_DETECTION).result(),
                outcomes.get(AnalyzerKind.MANIPULATION).result(),
                outcomes.get(AnalyzerKind.AUTHENTICITY).result());
        aggregator.validate(result, duration);

        progress.completeStage("completed", "Video analysis completed successfully");
        transition(state, AnalysisState.COMPLETED);
        log.info("Video analysis completed: score={}, failedKinds={}",
                result.overall().credibilityScore(), failures.size());
        return result;
    }

    private CompletableFuture<AnalyzerOutcome> runAnalyzer(AnalyzerKind kind, AnalysisRequest request,
                                                           AnalysisOptions opts, ProgressReporter progress) {
        AnalyzerAdapter adapter = adapters.get(kind);
        CompletableFuture<AnalyzerResult> task;
        if (adapter == null) {
            task = CompletableFuture.failedFuture(
                    new AnalyzerFailureException(kind, "no analyzer registered for " + kind.wireName()));
        } else {
            try {
                task = CompletableFuture.supplyAsync(() -> executeWithRetry(adapter, request, opts), analysisExecutor);
            } catch (RejectedExecutionException e) {
                task = CompletableFuture.failedFuture(e);
            }
        }

        return task.handle((result, ex) -> {
            AnalyzerOutcome outcome;
            if (ex == null) {
                outcome = new AnalyzerOutcome.Succeeded(kind, result);
                progress.completeStage(kind.wireName(), kind.displayName() + " completed");
            } else {
                outcome = AnalyzerOutcome.Defaulted.of(kind, kind.displayName() 
                        + " analysis failed: " + ExceptionUtils.rootMessage(ex));
                progress.completeStage(kind.wireName(), kind.displayName() + " failed after retries");
            }
            return outcome;
        });
    }

    /**
     * 시도마다 타임아웃과 경주시키고, 실패하면 2^attempt * base 만큼 쉬고 다시 시도.
     * 시도는 순차적이며 타임아웃난 시도의 결과는 버린다.
     */
    AnalyzerResult executeWithRetry(AnalyzerAdapter adapter, AnalysisRequest request, AnalysisOptions opts) {
        AnalyzerKind kind = adapter.kind();
        String name = kind.displayName();
        RuntimeException lastError = null;

        for (int attempt = 0; attempt <= opts.retryAttempts(); attempt++) {
            CompletableFuture<AnalyzerResult> future = null;
            try {
                future = adapter.analyze(request);
                return future.get(opts.timeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = new AnalyzerFailureException(kind, name + " timed out after " + opts.timeoutMs() + "ms");
            } catch (ExecutionException e) {
                lastError = toFailure(kind, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnalyzerFailureException(kind, name + " interrupted", e);
            } catch (RuntimeException e) {
                lastError = toFailure(kind, e);
            }

            if (attempt < opts.retryAttempts()) {
                log.warn("{} attempt {} failed, retrying: {}", name, attempt + 1, lastError.getMessage());
                backoff(kind, attempt);
            } else {
                log.warn("{} attempt {} failed, no retries left: {}", name, attempt + 1, lastError.getMessage());
            }
        }
        throw lastError != null ? lastError
                : new AnalyzerFailureException(kind, name + " failed after " + (opts.retryAttempts() + 1) + " attempts");
    }

    private void backoff(AnalyzerKind kind, int attempt) {
        long delay = (1L << attempt) * config.getBackoffBaseMs();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalyzerFailureException(kind, kind.displayName() + " interrupted during backoff", e);
        }
    }

    // ===================== 부가 기능 =====================

    private AnalysisOptions defaultOptions() {
        return new AnalysisOptions(config.getTimeoutMs(), config.getRetryAttempts());
    }

    /** 대략적인 소요 시간(초): MB당 2초 + 분석기당 5초 + 영상 1분당 0.5초, 최소 10초 */
    public long estimateAnalysisSeconds(long sizeBytes, Set<AnalyzerKind> kinds, double durationSeconds) {
        int kindCount = (kinds == null || kinds.isEmpty()) ? AnalyzerKind.values().length : kinds.size();
        double sizeMb = sizeBytes / (1024.0 * 1024.0);
        double estimate = sizeMb * 2 + kindCount * 5 + (durationSeconds / 60.0) * 0.5;
        return Math.max(10, Math.round(estimate));
    }

    public ServiceHealthResponse checkHealth() {
        List<String> errors = new ArrayList<>();
        boolean providerReady = provider.isConfigured();
        if (!providerReady) {
            errors.add("Gemini API key not configured");
        }

        Map<String, Boolean> services = new LinkedHashMap<>();
        services.put(provider.name(), providerReady);
        services.put("aiDetection", providerReady && adapters.containsKey(AnalyzerKind.AI_DETECTION));
        services.put("manipulation", providerReady && adapters.containsKey(AnalyzerKind.MANIPULATION));
        services.put("authenticity", providerReady && adapters.containsKey(AnalyzerKind.AUTHENTICITY));
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            if (!adapters.containsKey(kind)) {
                errors.add("No analyzer registered for " + kind.wireName());
            }
        }

        boolean healthy = services.values().stream().allMatch(Boolean::booleanValue);
        return new ServiceHealthResponse(healthy, services, errors);
    }

    /** 진행 중 분석 취소는 지원하지 않는다. 호출자는 전송 계층에서 끊고 결과를 버린다. */
    public boolean cancelAnalysis(String analysisId) {
        log.warn("Analysis cancellation requested for {} but not implemented", analysisId);
        return false;
    }

    // ===================== 내부 유틸 =====================

    private static AnalysisState transition(AnalysisState from, AnalysisState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal analysis state transition: " + from + " -> " + to);
        }
        log.debug("Analysis state {} -> {}", from, to);
        return to;
    }

    private static RuntimeException toFailure(AnalyzerKind kind, Throwable cause) {
        Throwable t = ExceptionUtils.unwrap(cause);
        if (t instanceof AnalyzerFailureException afe) return afe;
        return new AnalyzerFailureException(kind, ExceptionUtils.rootMessage(t), t);
    }
}
