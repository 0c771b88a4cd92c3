package com.goormthonuniv.videocheck.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthenticitySource(
        String url,              // 선택 (응답 텍스트만으로는 대부분 null)
        double similarity,       // 0~100
        String source,           // "YouTube" | "News Media" | "Unknown Source" ...
        boolean verified         // 플랫폼 계열별 사전값
) {}
