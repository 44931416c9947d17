package com.ryuqq.resilience.adapter.inmemory.circuit;

import com.ryuqq.resilience.core.event.IsolatingListener;
import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.metrics.CircuitBreakerMetrics;
import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.statemachine.CircuitTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 횟수 기반 {@link CircuitBreaker} 구현.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED    --(연속 실패 == failureThreshold)--&gt; OPEN
 * OPEN      --(timeoutMs 경과, 다음 조회 시)----&gt; HALF_OPEN
 * HALF_OPEN --(연속 성공 == successThreshold)--&gt; CLOSED
 * HALF_OPEN --(probe 실패)---------------------&gt; OPEN
 * </pre>
 *
 * <p>HALF_OPEN 에서는 최대 {@code halfOpenMax} 개의 probe 만 동시에 허용합니다.
 * probe 슬롯은 {@link CallPermission} 의 onSuccess/onFailure/release 중 하나가 호출될 때 반환됩니다.</p>
 *
 * <p>상태가 바뀔 때마다 epoch 가 증가하며, 이전 epoch 에 허용된 호출의 결과는 무시됩니다.
 * 늦게 도착한 성공이 이미 다시 열린 Circuit 을 닫지 못하고,
 * 동시 실패는 각각 정확히 한 번만 집계됩니다.</p>
 *
 * <p>리스너는 락 밖에서 호출되며, 리스너 예외는 WARN 로그 후 무시됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private long epoch;
    private int failures;
    private int halfOpenSuccesses;
    private int halfOpenInFlight;
    private long lastStateChangeAt;
    private long openedAt;
    private Long lastFailureAt;
    private long totalOpens;

    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), ResilienceListener.NONE);
    }

    /**
     * ConsecutiveFailureCircuitBreaker 생성.
     *
     * @param config Circuit Breaker 설정
     * @param clock 시간 소스
     * @param listener 상태 전이 리스너 (예외는 격리됨)
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config, Clock clock, ResilienceListener listener) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.listener = IsolatingListener.wrap(listener);
        this.lastStateChangeAt = clock.millis();
    }

    @Override
    public <T> T execute(Callable<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        CallPermission permission = acquirePermission();
        try {
            T result = operation.call();
            permission.onSuccess();
            return result;
        } catch (Exception e) {
            permission.onFailure(e);
            throw e;
        } finally {
            permission.release();
        }
    }

    @Override
    public CallPermission acquirePermission() {
        List<Runnable> events = new ArrayList<>(1);
        CallPermission permission;
        CircuitOpenException rejection = null;
        lock.lock();
        try {
            advanceLocked(events);
            permission = admitLocked();
            if (permission == null) {
                rejection = rejectionLocked();
            }
        } finally {
            lock.unlock();
        }
        fire(events);
        if (rejection != null) {
            throw rejection;
        }
        return permission;
    }

    @Override
    public CallPermission tryAcquirePermission() {
        List<Runnable> events = new ArrayList<>(1);
        CallPermission permission;
        lock.lock();
        try {
            advanceLocked(events);
            permission = admitLocked();
        } finally {
            lock.unlock();
        }
        fire(events);
        return permission;
    }

    @Override
    public CircuitBreakerState getState() {
        List<Runnable> events = new ArrayList<>(1);
        CircuitBreakerState current;
        lock.lock();
        try {
            advanceLocked(events);
            current = state;
        } finally {
            lock.unlock();
        }
        fire(events);
        return current;
    }

    @Override
    public boolean isOpen() {
        return getState() == CircuitBreakerState.OPEN;
    }

    @Override
    public boolean allowsExecution() {
        List<Runnable> events = new ArrayList<>(1);
        boolean allowed;
        lock.lock();
        try {
            advanceLocked(events);
            switch (state) {
                case CLOSED:
                    allowed = true;
                    break;
                case HALF_OPEN:
                    allowed = halfOpenInFlight < config.halfOpenMax();
                    break;
                default:
                    allowed = false;
            }
        } finally {
            lock.unlock();
        }
        fire(events);
        return allowed;
    }

    @Override
    public long getTimeUntilCloseMs() {
        lock.lock();
        try {
            return remainingOpenMsLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerMetrics getMetrics() {
        List<Runnable> events = new ArrayList<>(1);
        CircuitBreakerMetrics metrics;
        lock.lock();
        try {
            advanceLocked(events);
            metrics = new CircuitBreakerMetrics(state, failures, lastFailureAt, lastStateChangeAt, totalOpens);
        } finally {
            lock.unlock();
        }
        fire(events);
        return metrics;
    }

    /**
     * CLOSED 로 재초기화하고 모든 카운터를 지웁니다.
     *
     * <p>상태 전이가 아닌 관리 작업입니다. CLOSED 가 아니었던 경우 onCircuitClose 가 호출됩니다.</p>
     */
    @Override
    public void reset() {
        boolean wasClosed;
        lock.lock();
        try {
            wasClosed = state == CircuitBreakerState.CLOSED;
            state = CircuitBreakerState.CLOSED;
            epoch++;
            failures = 0;
            halfOpenSuccesses = 0;
            halfOpenInFlight = 0;
            lastFailureAt = null;
            totalOpens = 0;
            lastStateChangeAt = clock.millis();
        } finally {
            lock.unlock();
        }
        if (!wasClosed) {
            log.info("Circuit breaker reset to CLOSED");
            listener.onCircuitClose();
        }
    }

    /**
     * 유지보수 등을 위해 Circuit 을 즉시 OPEN 으로 전환합니다. 이미 OPEN 이면 무시합니다.
     */
    @Override
    public void forceOpen() {
        List<Runnable> events = new ArrayList<>(1);
        lock.lock();
        try {
            if (state != CircuitBreakerState.OPEN) {
                transitionLocked(CircuitBreakerState.OPEN, events);
            }
        } finally {
            lock.unlock();
        }
        fire(events);
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private void advanceLocked(List<Runnable> events) {
        if (state == CircuitBreakerState.OPEN && remainingOpenMsLocked() == 0) {
            transitionLocked(CircuitBreakerState.HALF_OPEN, events);
        }
    }

    private long remainingOpenMsLocked() {
        if (state != CircuitBreakerState.OPEN) {
            return 0;
        }
        return Math.max(0, config.timeoutMs() - (clock.millis() - openedAt));
    }

    private CallPermission admitLocked() {
        switch (state) {
            case CLOSED:
                return new EpochPermission(epoch, false);
            case HALF_OPEN:
                if (halfOpenInFlight < config.halfOpenMax()) {
                    halfOpenInFlight++;
                    return new EpochPermission(epoch, true);
                }
                return null;
            default:
                return null;
        }
    }

    private CircuitOpenException rejectionLocked() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            return new CircuitOpenException(
                "Circuit breaker is half-open - probe limit (" + config.halfOpenMax() + ") reached", 0);
        }
        long retryAfter = remainingOpenMsLocked();
        return new CircuitOpenException(
            "Circuit breaker is open (" + failures + " failures). Retry after " + retryAfter + "ms", retryAfter);
    }

    private void onSuccessLocked(EpochPermission permission, List<Runnable> events) {
        if (permission.admittedEpoch != epoch) {
            return;
        }
        if (permission.probe) {
            halfOpenInFlight--;
        }
        if (state == CircuitBreakerState.CLOSED) {
            failures = 0;
        } else if (state == CircuitBreakerState.HALF_OPEN) {
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= config.successThreshold()) {
                transitionLocked(CircuitBreakerState.CLOSED, events);
            }
        }
    }

    private void onFailureLocked(EpochPermission permission, List<Runnable> events) {
        if (permission.admittedEpoch != epoch) {
            return;
        }
        if (permission.probe) {
            halfOpenInFlight--;
        }
        lastFailureAt = clock.millis();
        if (state == CircuitBreakerState.CLOSED) {
            failures++;
            if (failures >= config.failureThreshold()) {
                transitionLocked(CircuitBreakerState.OPEN, events);
            }
        } else if (state == CircuitBreakerState.HALF_OPEN) {
            transitionLocked(CircuitBreakerState.OPEN, events);
        }
    }

    private void onReleaseLocked(EpochPermission permission) {
        if (permission.admittedEpoch == epoch && permission.probe) {
            halfOpenInFlight--;
        }
    }

    private void transitionLocked(CircuitBreakerState next, List<Runnable> events) {
        CircuitBreakerState previous = state;
        state = CircuitTransition.transition(previous, next);
        epoch++;
        lastStateChangeAt = clock.millis();
        halfOpenSuccesses = 0;
        halfOpenInFlight = 0;

        switch (next) {
            case OPEN:
                openedAt = lastStateChangeAt;
                totalOpens++;
                int failuresAtOpen = failures;
                log.warn("Circuit breaker opened: {} → OPEN (failures={}, totalOpens={})",
                    previous, failuresAtOpen, totalOpens);
                events.add(() -> listener.onCircuitOpen(failuresAtOpen));
                break;
            case HALF_OPEN:
                log.debug("Circuit breaker half-open after {}ms", config.timeoutMs());
                events.add(listener::onCircuitHalfOpen);
                break;
            case CLOSED:
                failures = 0;
                log.info("Circuit breaker closed after {} successful probes", config.successThreshold());
                events.add(listener::onCircuitClose);
                break;
            default:
                break;
        }
    }

    private static void fire(List<Runnable> events) {
        for (Runnable event : events) {
            event.run();
        }
    }

    /**
     * 허용 시점의 epoch 를 기억하는 단일 사용 permission.
     */
    private final class EpochPermission implements CallPermission {

        private final long admittedEpoch;
        private final boolean probe;
        private final AtomicBoolean used = new AtomicBoolean();

        private EpochPermission(long admittedEpoch, boolean probe) {
            this.admittedEpoch = admittedEpoch;
            this.probe = probe;
        }

        @Override
        public void onSuccess() {
            if (!used.compareAndSet(false, true)) {
                return;
            }
            List<Runnable> events = new ArrayList<>(1);
            lock.lock();
            try {
                onSuccessLocked(this, events);
            } finally {
                lock.unlock();
            }
            fire(events);
        }

        @Override
        public void onFailure(Throwable throwable) {
            if (!used.compareAndSet(false, true)) {
                return;
            }
            List<Runnable> events = new ArrayList<>(1);
            lock.lock();
            try {
                onFailureLocked(this, events);
            } finally {
                lock.unlock();
            }
            if (log.isDebugEnabled()) {
                log.debug("Circuit breaker recorded failure: {}", String.valueOf(throwable));
            }
            fire(events);
        }

        @Override
        public void release() {
            if (!used.compareAndSet(false, true)) {
                return;
            }
            lock.lock();
            try {
                onReleaseLocked(this);
            } finally {
                lock.unlock();
            }
        }
    }
}
