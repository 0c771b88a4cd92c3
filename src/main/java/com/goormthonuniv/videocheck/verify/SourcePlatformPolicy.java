package com.goormthonuniv.videocheck.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 진위 검증 응답에서 언급된 출처 플랫폼을 식별하는 정책 클래스.
 * - 패턴은 단어 경계 기준 (예: "ig" 가 "signal" 에 걸리지 않도록)
 * - verified 는 플랫폼 계열별 사전값이다: 소셜 = false, 언론/원본 = true
 * - 선언 순서가 곧 출력 순서
 */
public class SourcePlatformPolicy {

    public record Platform(String name, Pattern pattern, boolean verified) {}

    private final List<Platform> platforms = new ArrayList<>();

    public SourcePlatformPolicy() {
        // ===== 소셜/동영상 플랫폼 (재업로드 가능성 → 미검증) =====
        put("YouTube", "youtube|yt", false);
        put("Facebook", "facebook|fb", false);
        put("Instagram", "instagram|ig", false);
        put("Twitter/X", "twitter|x\\.com", false);
        put("TikTok", "tiktok", false);

        // ===== 언론/원본 =====
        put("News Media", "news|broadcast(?:ing|er|s)?", true);
        put("Original Source", "original|sources?", true);
    }

    /** 응답 텍스트에서 언급된 플랫폼 목록 (선언 순서) */
    public List<Platform> detect(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<Platform> out = new ArrayList<>();
        for (Platform p : platforms) {
            if (p.pattern().matcher(text).find()) {
                out.add(p);
            }
        }
        return out;
    }

    private void put(String name, String alternatives, boolean verified) {
        Pattern p = Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
        platforms.add(new Platform(name, p, verified));
    }
}
