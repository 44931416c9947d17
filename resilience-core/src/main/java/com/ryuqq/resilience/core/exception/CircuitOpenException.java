package com.ryuqq.resilience.core.exception;

/**
 * Circuit Breaker 가 OPEN 이거나 HALF_OPEN 프로브 슬롯이 소진되어 요청이 거부된 경우.
 *
 * <p>감싼 작업은 호출되지 않았습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ResilienceException {

    private final long retryAfterMs;

    /**
     * @param message 메시지
     * @param retryAfterMs OPEN 타임아웃 만료까지 남은 시간 (밀리초, 0 이상)
     */
    public CircuitOpenException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = Math.max(0, retryAfterMs);
    }

    /**
     * @param retryAfterMs OPEN 타임아웃 만료까지 남은 시간 (밀리초)
     */
    public CircuitOpenException(long retryAfterMs) {
        this("Circuit breaker is open - request rejected", retryAfterMs);
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
