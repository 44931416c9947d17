package com.ryuqq.resilience.core.exception;

/**
 * 동시성 세마포어가 제한 시간 내에 permit 을 발급하지 못한 경우.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class AcquireTimeoutException extends ResilienceException {

    private final long timeoutMs;
    private final int waitingCount;

    /**
     * @param timeoutMs 대기한 시간 (밀리초)
     * @param waitingCount 타임아웃 시점에 남아있는 대기자 수
     */
    public AcquireTimeoutException(long timeoutMs, int waitingCount) {
        super(String.format(
            "Timed out waiting for permit after %dms (%d requests waiting)", timeoutMs, waitingCount));
        this.timeoutMs = timeoutMs;
        this.waitingCount = waitingCount;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getWaitingCount() {
        return waitingCount;
    }
}
