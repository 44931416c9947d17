package com.ryuqq.resilience.core.metrics;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 지표 스냅샷.
 *
 * @param state 현재 상태
 * @param failures 연속 실패 수
 * @param lastFailureAt 마지막 실패 시각 (epoch 밀리초, 실패가 없었으면 null)
 * @param lastStateChangeAt 마지막 상태 변경 시각 (epoch 밀리초)
 * @param totalOpens OPEN 으로 전이한 누적 횟수
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerMetrics(
    CircuitBreakerState state,
    int failures,
    Long lastFailureAt,
    long lastStateChangeAt,
    long totalOpens
) {
}
