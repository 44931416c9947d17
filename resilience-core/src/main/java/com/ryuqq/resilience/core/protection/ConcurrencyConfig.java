package com.ryuqq.resilience.core.protection;

/**
 * 동시성 제한기 (Semaphore) 설정.
 *
 * @param maxConcurrent 최대 동시 실행 수 (기본 20)
 * @param queueSize permit 대기 목록 최대 길이 (기본 1000)
 * @param timeoutMs permit 최대 대기 시간 (밀리초, 기본 30000)
 * @author Resilience Team
 * @since 1.0.0
 */
public record ConcurrencyConfig(int maxConcurrent, int queueSize, long timeoutMs) {

    /**
     * 기본 설정 생성자 (maxConcurrent=20, queueSize=1000, timeoutMs=30000).
     */
    public ConcurrencyConfig() {
        this(20, 1000, 30000);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxConcurrent or timeoutMs is not positive
     * @throws IllegalArgumentException if queueSize is negative
     */
    public ConcurrencyConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
        if (queueSize < 0) {
            throw new IllegalArgumentException("queueSize cannot be negative (current: " + queueSize + ")");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
    }

    public ConcurrencyConfig withMaxConcurrent(int maxConcurrent) {
        return new ConcurrencyConfig(maxConcurrent, queueSize, timeoutMs);
    }

    public ConcurrencyConfig withQueueSize(int queueSize) {
        return new ConcurrencyConfig(maxConcurrent, queueSize, timeoutMs);
    }

    public ConcurrencyConfig withTimeoutMs(long timeoutMs) {
        return new ConcurrencyConfig(maxConcurrent, queueSize, timeoutMs);
    }
}
