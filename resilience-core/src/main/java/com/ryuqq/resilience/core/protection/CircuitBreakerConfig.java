package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN 으로 전이하는 연속 실패 수 (기본 5)
 * @param successThreshold HALF_OPEN 에서 CLOSED 로 전이하는 연속 성공 수 (기본 2)
 * @param timeoutMs OPEN 유지 시간, 이후 HALF_OPEN 으로 전이 (밀리초, 기본 30000)
 * @param halfOpenMax HALF_OPEN 에서 동시에 허용하는 프로브 수 (기본 3)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, int successThreshold, long timeoutMs, int halfOpenMax) {

    /**
     * 기본 설정 생성자 (5 failures, 2 successes, 30s, 3 probes).
     */
    public CircuitBreakerConfig() {
        this(5, 2, 30000, 3);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive (current: " + successThreshold + ")");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        if (halfOpenMax <= 0) {
            throw new IllegalArgumentException("halfOpenMax must be positive (current: " + halfOpenMax + ")");
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, halfOpenMax);
    }

    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, halfOpenMax);
    }

    public CircuitBreakerConfig withTimeoutMs(long timeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, halfOpenMax);
    }

    public CircuitBreakerConfig withHalfOpenMax(int halfOpenMax) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs, halfOpenMax);
    }
}
