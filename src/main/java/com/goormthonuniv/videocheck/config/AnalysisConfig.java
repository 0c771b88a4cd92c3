package com.goormthonuniv.videocheck.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 분석 오케스트레이션 기본값.
 *
 * application.yml:
 * videocheck:
 *   analysis:
 *     timeout-ms: 30000
 *     retry-attempts: 2
 */
@Configuration
@ConfigurationProperties(prefix = "videocheck.analysis")
@Data
public class AnalysisConfig {

    /** 분석기 시도 1회 타임아웃 */
    private long timeoutMs = 30_000;

    /** 첫 실패 이후 추가 시도 횟수 */
    private int retryAttempts = 2;

    /** 재시도 대기 = 2^attempt * base */
    private long backoffBaseMs = 1_000;

    /** 길이 힌트가 없거나 0 이하일 때 */
    private double defaultDurationSeconds = 60;

    private String defaultMimeType = "video/mp4";
}
