package com.goormthonuniv.videocheck.dto;

import java.util.Arrays;
import java.util.Locale;

public enum AnalyzerKind {
    AI_DETECTION("ai-detection", "AI Detection"),
    MANIPULATION("manipulation", "Manipulation Detection"),
    AUTHENTICITY("authenticity", "Authenticity Verification");

    private final String wireName;     // API 요청/진행 stage 에 쓰는 이름
    private final String displayName;  // 로그/실패 메시지용

    AnalyzerKind(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String wireName() { return wireName; }

    public String displayName() { return displayName; }

    /** "ai-detection" | "AI_DETECTION" 둘 다 허용 */
    public static AnalyzerKind fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("analysis type is blank");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(n) || k.name().toLowerCase(Locale.ROOT).equals(n))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid analysis type: " + name + ". Valid types: ai-detection, manipulation, authenticity"));
    }
}
