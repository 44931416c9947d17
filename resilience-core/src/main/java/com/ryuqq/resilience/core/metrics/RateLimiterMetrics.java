package com.ryuqq.resilience.core.metrics;

/**
 * Rate Limiter 지표 스냅샷.
 *
 * @param tokensAvailable 현재 가용 토큰 수 (내림)
 * @param requestsThrottled 대기해야 했던(또는 대기 후 거부된) 요청 누적 수
 * @param avgWaitTimeMs 대기한 요청의 평균 대기 시간 (밀리초)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimiterMetrics(int tokensAvailable, long requestsThrottled, double avgWaitTimeMs) {
}
