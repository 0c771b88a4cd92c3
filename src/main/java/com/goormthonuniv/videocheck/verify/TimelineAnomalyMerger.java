package com.goormthonuniv.videocheck.verify;

import com.goormthonuniv.videocheck.dto.TimelineAnomaly;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 여러 variant / 여러 타임스탬프가 같은 사건을 중복 보고하므로 구간 병합으로 정리한다.
 * 인접 허용치(2초) 이내면 같은 사건으로 본다. 병합 결과를 다시 병합해도 그대로다.
 */
public final class TimelineAnomalyMerger {

    public static final double ADJACENCY_TOLERANCE_SECONDS = 2.0;

    private TimelineAnomalyMerger() {}

    public static List<TimelineAnomaly> merge(List<TimelineAnomaly> anomalies) {
        if (anomalies == null || anomalies.isEmpty()) return List.of();

        // List.sort 는 안정 정렬 → 같은 timestamp 는 입력 순서 유지
        List<TimelineAnomaly> sorted = new ArrayList<>(anomalies);
        sorted.sort(Comparator.comparingDouble(TimelineAnomaly::timestamp));

        List<TimelineAnomaly> merged = new ArrayList<>();
        TimelineAnomaly current = sorted.get(0);

        for (int i = 1; i < sorted.size(); i++) {
            TimelineAnomaly next = sorted.get(i);
            if (overlaps(current, next)) {
                current = combine(current, next);
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return List.copyOf(merged);
    }

    static boolean overlaps(TimelineAnomaly current, TimelineAnomaly next) {
        return next.timestamp() <= current.end() + ADJACENCY_TOLERANCE_SECONDS;
    }

    private static TimelineAnomaly combine(TimelineAnomaly current, TimelineAnomaly next) {
        double duration = Math.max(current.duration(), next.end() - current.timestamp());
        // 동점이면 current 유지
        var type = next.confidence() > current.confidence() ? next.type() : current.type();
        return new TimelineAnomaly(
                current.timestamp(),
                duration,
                type,
                Math.max(current.confidence(), next.confidence()),
                current.description() + "; " + next.description());
    }
}
