package com.goormthonuniv.videocheck.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 분석기 작업과 추론 호출은 서로 다른 풀에서 돈다.
 * 분석기 작업은 자기 시도 결과를 기다리며 블록되고, 추론 호출은 블록되는 말단 작업이라
 * 같은 풀을 쓰면 서로를 기다리다 멈출 수 있다.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Value("${videocheck.executor.analysis.core-pool-size:6}")
    private int analysisCorePoolSize;

    @Value("${videocheck.executor.analysis.max-pool-size:24}")
    private int analysisMaxPoolSize;

    @Value("${videocheck.executor.inference.core-pool-size:9}")
    private int inferenceCorePoolSize;

    @Value("${videocheck.executor.inference.max-pool-size:48}")
    private int inferenceMaxPoolSize;

    // 0 = 대기열 없이 바로 스레드를 늘린다. 앞 시도의 느린 호출 뒤에 재시도가 줄서지 않도록
    @Value("${videocheck.executor.inference.queue-capacity:0}")
    private int inferenceQueueCapacity;

    @Value("${videocheck.executor.queue-capacity:100}")
    private int queueCapacity;

    /**
     * 분석기 종류별 작업 (시도 + 타임아웃 + 재시도 대기)
     */
    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor() {
        return build("analysis-", analysisCorePoolSize, analysisMaxPoolSize, queueCapacity);
    }

    /**
     * 프롬프트 variant 별 추론 호출.
     * 요청 1건 = 분석기 3 x variant 3 = 호출 9개. max 를 넘으면 해당 variant 만 실패 처리된다.
     */
    @Bean(name = "inferenceExecutor")
    public Executor inferenceExecutor() {
        return build("inference-", inferenceCorePoolSize, inferenceMaxPoolSize, inferenceQueueCapacity);
    }

    /**
     * 진행률 콜백 전달 (파이프라인을 막지 않도록 분리)
     */
    @Bean(name = "progressExecutor")
    public Executor progressExecutor() {
        return build("progress-", 1, 2, 500);
    }

    private static ThreadPoolTaskExecutor build(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        log.debug("Executor initialized: prefix={}, core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }
}
