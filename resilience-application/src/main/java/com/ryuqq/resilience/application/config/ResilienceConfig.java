package com.ryuqq.resilience.application.config;

import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.ConcurrencyConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.spi.QueueConfig;

/**
 * Resilience Layer 전체 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>enabled: true</li>
 *   <li>rateLimiter: bucketSize=100, refillRate=50/s</li>
 *   <li>concurrency: maxConcurrent=20, queueSize=1000, timeoutMs=30000</li>
 *   <li>circuitBreaker: failureThreshold=5, successThreshold=2, timeoutMs=30000, halfOpenMax=3</li>
 *   <li>queue: critical=100, high=500, normal=1000, low=2000, background=5000</li>
 * </ul>
 *
 * <p>{@code enabled=false} 이면 모든 보호 장치를 우회합니다.
 * 이 경우에도 하위 설정은 유효한 값이어야 합니다.</p>
 *
 * @param enabled 보호 장치 활성화 여부
 * @param rateLimiter Token Bucket 설정
 * @param concurrency 동시성 제한 설정
 * @param circuitBreaker Circuit Breaker 설정
 * @param queue 우선순위 큐 설정
 * @author Resilience Team
 * @since 1.0.0
 */
public record ResilienceConfig(
    boolean enabled,
    RateLimiterConfig rateLimiter,
    ConcurrencyConfig concurrency,
    CircuitBreakerConfig circuitBreaker,
    QueueConfig queue
) {

    /**
     * 기본 설정 생성자.
     */
    public ResilienceConfig() {
        this(true, new RateLimiterConfig(), new ConcurrencyConfig(), new CircuitBreakerConfig(), new QueueConfig());
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 하위 설정이 null인 경우
     */
    public ResilienceConfig {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (concurrency == null) {
            throw new IllegalArgumentException("concurrency cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
    }

    public ResilienceConfig withEnabled(boolean enabled) {
        return new ResilienceConfig(enabled, rateLimiter, concurrency, circuitBreaker, queue);
    }

    public ResilienceConfig withRateLimiter(RateLimiterConfig rateLimiter) {
        return new ResilienceConfig(enabled, rateLimiter, concurrency, circuitBreaker, queue);
    }

    public ResilienceConfig withConcurrency(ConcurrencyConfig concurrency) {
        return new ResilienceConfig(enabled, rateLimiter, concurrency, circuitBreaker, queue);
    }

    public ResilienceConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new ResilienceConfig(enabled, rateLimiter, concurrency, circuitBreaker, queue);
    }

    public ResilienceConfig withQueue(QueueConfig queue) {
        return new ResilienceConfig(enabled, rateLimiter, concurrency, circuitBreaker, queue);
    }
}
