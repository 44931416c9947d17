package com.ryuqq.resilience.core.exception;

/**
 * Token Bucket 이 제한 시간 내에 토큰을 발급하지 못한 경우.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RateLimitExceededException extends ResilienceException {

    private final int requested;
    private final int tokensAvailable;
    private final long refillInMs;

    /**
     * @param requested 요청한 토큰 수
     * @param tokensAvailable 실패 시점의 가용 토큰 수 (내림)
     * @param refillInMs 요청량이 채워지기까지 남은 예상 시간 (밀리초)
     */
    public RateLimitExceededException(int requested, int tokensAvailable, long refillInMs) {
        super(String.format(
            "Rate limit exceeded (requested %d, %d tokens available, refill in %dms)",
            requested, tokensAvailable, refillInMs));
        this.requested = requested;
        this.tokensAvailable = tokensAvailable;
        this.refillInMs = refillInMs;
    }

    public int getRequested() {
        return requested;
    }

    public int getTokensAvailable() {
        return tokensAvailable;
    }

    public long getRefillInMs() {
        return refillInMs;
    }
}
