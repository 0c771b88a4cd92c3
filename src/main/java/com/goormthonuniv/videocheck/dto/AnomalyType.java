package com.goormthonuniv.videocheck.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyType {
    CUT,
    INSERTION,
    DELETION,
    TEMPORAL_INCONSISTENCY,
    QUALITY_CHANGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
