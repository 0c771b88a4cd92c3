package com.goormthonuniv.videocheck.service;

import java.util.EnumSet;
import java.util.Set;

public enum AnalysisState {
    INITIALIZING,
    RUNNING_ANALYZERS,
    AGGREGATING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(AnalysisState next) {
        return allowedNext().contains(next);
    }

    // FAILED 로 가는 길은 RUNNING_ANALYZERS 에서 전부 실패한 경우 하나뿐
    private Set<AnalysisState> allowedNext() {
        return switch (this) {
            case INITIALIZING -> EnumSet.of(RUNNING_ANALYZERS);
            case RUNNING_ANALYZERS -> EnumSet.of(AGGREGATING, FAILED);
            case AGGREGATING -> EnumSet.of(COMPLETED);
            case COMPLETED, FAILED -> EnumSet.noneOf(AnalysisState.class);
        };
    }
}
