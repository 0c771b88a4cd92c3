package com.goormthonuniv.videocheck.exception;

import java.util.List;

/** 요청된 분석기가 전부 재시도까지 실패한 경우. 코어 밖으로 나가는 유일한 오류. */
public class AllAnalyzersFailedException extends RuntimeException {

    private final List<String> reasons;

    public AllAnalyzersFailedException(List<String> reasons) {
        super("All analyses failed: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
