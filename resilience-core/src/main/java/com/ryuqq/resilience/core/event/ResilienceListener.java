package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.model.Priority;

/**
 * Resilience 이벤트 리스너.
 *
 * <p>모든 메서드는 기본 구현이 비어 있으므로 필요한 이벤트만 오버라이드합니다.
 * 리스너에서 발생한 예외는 호출자에게 전파되지 않습니다 ({@link IsolatingListener}).</p>
 *
 * <p>Circuit 이벤트는 Circuit Breaker 의 락 밖에서 호출됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResilienceListener {

    /**
     * 아무 일도 하지 않는 리스너.
     */
    ResilienceListener NONE = new ResilienceListener() {
    };

    /**
     * Circuit 이 OPEN 으로 전이됨.
     *
     * @param failures 전이 시점의 연속 실패 횟수
     */
    default void onCircuitOpen(int failures) {
    }

    default void onCircuitClose() {
    }

    default void onCircuitHalfOpen() {
    }

    /**
     * 우선순위 큐의 티어가 가득 차 요청이 거부됨.
     *
     * @param priority 가득 찬 티어
     */
    default void onQueueFull(Priority priority) {
    }

    /**
     * 토큰 대기가 발생함.
     *
     * @param waitTimeMs 대기 시간 (milliseconds)
     */
    default void onThrottle(long waitTimeMs) {
    }
}
