package com.goormthonuniv.videocheck.dto;

import java.util.List;

/** 진위 검증 결과를 사람이 읽는 형태로 정리한 보고서 */
public record AuthenticityReport(
        String summary,
        List<String> details,           // 메타데이터 항목별 한 줄 (없는 항목은 생략)
        List<String> recommendations    // 신뢰도 구간 문장 + 검증된 출처 수
) {
    public AuthenticityReport {
        details = details == null ? List.of() : List.copyOf(details);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
