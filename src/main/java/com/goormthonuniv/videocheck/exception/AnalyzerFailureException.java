package com.goormthonuniv.videocheck.exception;

import com.goormthonuniv.videocheck.dto.AnalyzerKind;

/**
 * 분석기 한 종류의 시도 실패. 재시도 대상이며, 재시도를 모두 소진하면
 * 오케스트레이터가 신뢰도 0 기본 결과로 대체한다.
 */
public class AnalyzerFailureException extends RuntimeException {

    private final AnalyzerKind kind;

    public AnalyzerFailureException(AnalyzerKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalyzerFailureException(AnalyzerKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AnalyzerKind getKind() {
        return kind;
    }
}
