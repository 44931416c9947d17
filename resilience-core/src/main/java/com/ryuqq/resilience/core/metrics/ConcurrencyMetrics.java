package com.ryuqq.resilience.core.metrics;

/**
 * 동시성 제한기 지표 스냅샷.
 *
 * @param active 현재 실행 중(permit 보유) 요청 수
 * @param waiting permit 대기 중인 요청 수
 * @param maxReached 동시 보유자 수의 최고치
 * @param timeouts 대기 중 타임아웃된 요청 누적 수
 * @author Resilience Team
 * @since 1.0.0
 */
public record ConcurrencyMetrics(int active, int waiting, int maxReached, long timeouts) {
}
