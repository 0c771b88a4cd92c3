package com.goormthonuniv.videocheck.analyzer;

import com.goormthonuniv.videocheck.dto.AnalyzerKind;
import com.goormthonuniv.videocheck.dto.AnalyzerResult;

import java.util.concurrent.CompletableFuture;

public interface AnalyzerAdapter {
    AnalyzerKind kind();

    /**
     * 프롬프트 variant 들을 동시에 호출하고 하나의 결과로 접는다.
     * variant 가 전부 실패하면 {@link com.goormthonuniv.videocheck.exception.AnalyzerFailureException} 으로 완료된다.
     */
    CompletableFuture<AnalyzerResult> analyze(AnalysisRequest request);
}
