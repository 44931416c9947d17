package com.ryuqq.resilience.core.event;

import com.ryuqq.resilience.core.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 예외를 격리하는 리스너 래퍼.
 *
 * <p>위임 리스너가 던진 {@link RuntimeException} 은 WARN 으로 기록하고 삼킵니다.
 * 리스너 오류가 Rate Limiter, Circuit Breaker 상태나 호출자 결과에 영향을 주지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class IsolatingListener implements ResilienceListener {

    private static final Logger log = LoggerFactory.getLogger(IsolatingListener.class);

    private final ResilienceListener delegate;

    private IsolatingListener(ResilienceListener delegate) {
        this.delegate = delegate;
    }

    /**
     * 리스너를 격리 래퍼로 감쌈.
     *
     * @param listener 위임 리스너 (null이면 {@link ResilienceListener#NONE})
     * @return 격리된 리스너 (이미 격리된 경우 그대로 반환)
     */
    public static ResilienceListener wrap(ResilienceListener listener) {
        if (listener == null) {
            return ResilienceListener.NONE;
        }
        if (listener instanceof IsolatingListener || listener == ResilienceListener.NONE) {
            return listener;
        }
        return new IsolatingListener(listener);
    }

    @Override
    public void onCircuitOpen(int failures) {
        try {
            delegate.onCircuitOpen(failures);
        } catch (RuntimeException e) {
            log.warn("ResilienceListener.onCircuitOpen failed: failures={}", failures, e);
        }
    }

    @Override
    public void onCircuitClose() {
        try {
            delegate.onCircuitClose();
        } catch (RuntimeException e) {
            log.warn("ResilienceListener.onCircuitClose failed", e);
        }
    }

    @Override
    public void onCircuitHalfOpen() {
        try {
            delegate.onCircuitHalfOpen();
        } catch (RuntimeException e) {
            log.warn("ResilienceListener.onCircuitHalfOpen failed", e);
        }
    }

    @Override
    public void onQueueFull(Priority priority) {
        try {
            delegate.onQueueFull(priority);
        } catch (RuntimeException e) {
            log.warn("ResilienceListener.onQueueFull failed: priority={}", priority, e);
        }
    }

    @Override
    public void onThrottle(long waitTimeMs) {
        try {
            delegate.onThrottle(waitTimeMs);
        } catch (RuntimeException e) {
            log.warn("ResilienceListener.onThrottle failed: waitTimeMs={}", waitTimeMs, e);
        }
    }
}
