package com.goormthonuniv.videocheck.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.videocheck.dto.AnalysisProgress;
import com.goormthonuniv.videocheck.dto.AnalysisStatusResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * 분석 id 별 마지막 진행 상태. 오케스트레이터의 진행률 콜백이 채운다.
 * 만료되면 조회 시 없는 것으로 본다.
 */
@Slf4j
@Service
public class AnalysisStatusService {

    public static final String PROCESSING = "processing";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    // ===== 캐시 =====
    private final Cache<String, AnalysisStatusResponse> statuses;

    public AnalysisStatusService(@Value("${videocheck.status.ttl-minutes:30}") long ttlMinutes,
                                 @Value("${videocheck.status.max-entries:1000}") long maxEntries) {
        this.statuses = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
                .maximumSize(maxEntries)
                .build();
    }

    public void start(String analysisId) {
        statuses.put(analysisId, new AnalysisStatusResponse(analysisId, PROCESSING, 0,
                "initialization", "Analysis queued"));
    }

    /** 이미 끝난 분석에 늦게 도착한 진행률은 무시 */
    public void update(String analysisId, AnalysisProgress progress) {
        statuses.asMap().compute(analysisId, (id, prev) -> {
            if (prev != null && !PROCESSING.equals(prev.status())) return prev;
            return new AnalysisStatusResponse(id, PROCESSING, progress.progress(),
                    progress.stage(), progress.message());
        });
    }

    public void complete(String analysisId) {
        statuses.put(analysisId, new AnalysisStatusResponse(analysisId, COMPLETED, 100,
                "completed", "Video analysis completed successfully"));
    }

    public void fail(String analysisId, String message) {
        int last = get(analysisId).map(AnalysisStatusResponse::progress).orElse(0);
        statuses.put(analysisId, new AnalysisStatusResponse(analysisId, FAILED, last, "failed", message));
        log.debug("Analysis {} marked failed: {}", analysisId, message);
    }

    public Optional<AnalysisStatusResponse> get(String analysisId) {
        return Optional.ofNullable(statuses.getIfPresent(analysisId));
    }
}
