package com.goormthonuniv.videocheck.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WS = Pattern.compile("\\s+");

    private TextUtils() {}

    /** 키워드 검색용: null 안전 + 소문자 + 공백 정리 */
    public static String normalize(String text) {
        if (text == null) return "";
        return WS.matcher(text.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public static boolean containsAny(String normalized, String... keywords) {
        if (normalized == null || normalized.isEmpty()) return false;
        for (String k : keywords) {
            if (normalized.contains(k)) return true;
        }
        return false;
    }

    /** [start - radius, end + radius) 구간을 잘라 반환 (경계 자동 보정) */
    public static String window(String text, int start, int end, int radius) {
        if (text == null || text.isEmpty()) return "";
        int from = Math.max(0, start - radius);
        int to = Math.min(text.length(), Math.max(end, start) + radius);
        if (from >= to) return "";
        return text.substring(from, to);
    }

    public static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    /** 0~100 점수 범위 */
    public static double clampScore(double v) {
        return clamp(v, 0.0, 100.0);
    }

    public static String safe(String s) { return s == null ? "" : s; }
}
