package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.Priority;

/**
 * 대기열이 이미 가득 찬 상태에서 진입을 시도한 경우.
 *
 * <p>우선순위 큐의 티어가 가득 찼을 때와 세마포어 대기 목록이 가득 찼을 때
 * 모두 사용됩니다. 낮은 우선순위라도 조용히 버리지 않고 항상 이 예외를 던집니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class QueueFullException extends ResilienceException {

    private final Priority priority;
    private final int queueSize;

    /**
     * 우선순위 티어 포화.
     *
     * @param priority 가득 찬 티어
     * @param queueSize 해당 티어의 현재 크기
     */
    public QueueFullException(Priority priority, int queueSize) {
        super(String.format(
            "Queue full for priority '%s' (size: %d) - request rejected", priority.label(), queueSize));
        this.priority = priority;
        this.queueSize = queueSize;
    }

    /**
     * 세마포어 대기 목록 포화.
     *
     * @param queueSize 대기 목록 최대 크기
     */
    public QueueFullException(int queueSize) {
        super(String.format("Semaphore queue full (%d requests waiting)", queueSize));
        this.priority = null;
        this.queueSize = queueSize;
    }

    /**
     * 포화된 티어 조회.
     *
     * @return 티어, 세마포어 대기 목록 포화인 경우 null
     */
    public Priority getPriority() {
        return priority;
    }

    public int getQueueSize() {
        return queueSize;
    }
}
