package com.ryuqq.resilience.application.gate;

import com.ryuqq.resilience.core.metrics.CircuitBreakerMetrics;
import com.ryuqq.resilience.core.metrics.ConcurrencyMetrics;
import com.ryuqq.resilience.core.metrics.QueueMetrics;
import com.ryuqq.resilience.core.metrics.RateLimiterMetrics;

/**
 * 모든 보호 장치의 지표 스냅샷.
 *
 * @param rateLimiter Token Bucket 지표
 * @param concurrency 동시성 제한 지표
 * @param circuitBreaker Circuit Breaker 지표
 * @param queue 우선순위 큐 지표
 * @param timestamp 스냅샷 시각 (epoch milliseconds)
 * @author Resilience Team
 * @since 1.0.0
 */
public record ResilienceMetrics(
    RateLimiterMetrics rateLimiter,
    ConcurrencyMetrics concurrency,
    CircuitBreakerMetrics circuitBreaker,
    QueueMetrics queue,
    long timestamp
) {

    public ResilienceMetrics {
        if (rateLimiter == null || concurrency == null || circuitBreaker == null || queue == null) {
            throw new IllegalArgumentException("component metrics cannot be null");
        }
    }
}
