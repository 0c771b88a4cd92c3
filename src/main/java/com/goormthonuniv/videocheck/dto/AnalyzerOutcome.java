package com.goormthonuniv.videocheck.dto;

/**
 * 분석기 하나의 최종 결과. 실패해도 {@link Defaulted} 로 대체 결과를 들고 있으므로
 * 집계 단계는 세 섹션이 모두 채워져 있다고 가정할 수 있다.
 */
public sealed interface AnalyzerOutcome permits AnalyzerOutcome.Succeeded, AnalyzerOutcome.Defaulted {

    AnalyzerKind kind();

    AnalyzerResult result();

    default boolean succeeded() {
        return this instanceof Succeeded;
    }

    record Succeeded(AnalyzerKind kind, AnalyzerResult result) implements AnalyzerOutcome {}

    record Defaulted(AnalyzerKind kind, String reason, AnalyzerResult result) implements AnalyzerOutcome {

        public static Defaulted of(AnalyzerKind kind, String reason) {
            return new Defaulted(kind, reason, AnalyzerResult.defaulted(kind, reason));
        }
    }
}
