package com.goormthonuniv.videocheck.service;

import com.goormthonuniv.videocheck.dto.AnalysisProgress;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * 요청 1건의 진행률 보고.
 * 완료 카운터 증가와 이벤트 발행은 한 번에 직렬화되고, 콜백은 progressExecutor 에서
 * 순서대로 실행된다. 콜백이 느리거나 예외를 던져도 분석은 계속된다.
 */
@Slf4j
class ProgressReporter {

    private final Consumer<AnalysisProgress> sink;
    private final Executor executor;
    private final int totalStages;
    private int completedStages;
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    ProgressReporter(Consumer<AnalysisProgress> sink, Executor executor, int totalStages) {
        this.sink = sink;
        this.executor = executor;
        this.totalStages = totalStages;
    }

    /** 단계 하나 완료 후 보고 */
    synchronized void completeStage(String stage, String message) {
        completedStages++;
        report(stage, message);
    }

    /** 카운터 변화 없이 보고 */
    synchronized void report(String stage, String message) {
        int progress = (int) Math.round((double) Math.min(completedStages, totalStages) / totalStages * 100);
        emit(new AnalysisProgress(stage, progress, message));
    }

    private void emit(AnalysisProgress progress) {
        if (sink == null) return;
        try {
            tail = tail.handle((v, ex) -> null).thenRunAsync(() -> deliver(progress), executor);
        } catch (RejectedExecutionException e) {
            log.debug("Progress dropped (executor rejected): {}", progress.stage());
        }
    }

    private void deliver(AnalysisProgress progress) {
        try {
            sink.accept(progress);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed at stage={}: {}", progress.stage(), e.getMessage());
        }
    }
}
