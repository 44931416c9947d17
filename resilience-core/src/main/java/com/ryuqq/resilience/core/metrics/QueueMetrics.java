package com.ryuqq.resilience.core.metrics;

import com.ryuqq.resilience.core.model.Priority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 우선순위 큐 지표 스냅샷.
 *
 * @param total 전체 대기 요청 수
 * @param byPriority 티어별 대기 요청 수 (다섯 티어 모두 포함)
 * @param processed 큐에서 꺼내진 요청 누적 수
 * @param dropped 티어 포화로 거부된 요청 누적 수
 * @param oldestRequestAgeMs 가장 오래 대기한 요청의 대기 시간 (큐가 비었으면 null)
 * @author Resilience Team
 * @since 1.0.0
 */
public record QueueMetrics(
    int total,
    Map<Priority, Integer> byPriority,
    long processed,
    long dropped,
    Long oldestRequestAgeMs
) {

    public QueueMetrics {
        if (byPriority == null) {
            throw new IllegalArgumentException("byPriority cannot be null");
        }
        Map<Priority, Integer> copy = new EnumMap<>(Priority.class);
        copy.putAll(byPriority);
        byPriority = Collections.unmodifiableMap(copy);
    }
}
