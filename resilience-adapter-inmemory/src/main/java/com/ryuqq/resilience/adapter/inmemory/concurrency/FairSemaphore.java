package com.ryuqq.resilience.adapter.inmemory.concurrency;

import com.ryuqq.resilience.core.exception.AcquireTimeoutException;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.metrics.ConcurrencyMetrics;
import com.ryuqq.resilience.core.protection.ConcurrencyConfig;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO 공정성을 보장하는 {@link ConcurrencyLimiter} 구현.
 *
 * <p>동시에 실행 중인 작업을 {@code maxConcurrent} 개로 제한합니다.
 * 여유 permit 이 없으면 호출자는 대기열에 들어가며, 반환된 permit 은
 * 대기열의 맨 앞 대기자에게 직접 넘겨집니다 (active 수는 그대로 유지).</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>먼저 {@code acquire()} 를 호출한 스레드가 항상 먼저 permit 을 받음</li>
 *   <li>{@code tryAcquire()} 는 대기자를 앞지르지 않음</li>
 *   <li>대기열이 {@code queueSize} 에 도달하면 대기 없이 {@link QueueFullException}</li>
 *   <li>타임아웃/인터럽트 시 아무것도 점유하지 않음</li>
 *   <li>{@link Permit#release()} 는 멱등 (두 번째 호출은 WARN 로그만 남김)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class FairSemaphore implements ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(FairSemaphore.class);

    private final ConcurrencyConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();

    private int active;
    private int maxReached;
    private long timeouts;
    private long generation;

    /**
     * FairSemaphore 생성.
     *
     * @param config 동시성 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FairSemaphore(ConcurrencyConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public Permit tryAcquire() {
        lock.lock();
        try {
            if (active < config.maxConcurrent() && waiters.isEmpty()) {
                return grantLocked();
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 설정된 기본 타임아웃({@code timeoutMs})으로 permit 획득.
     */
    @Override
    public Permit acquire() throws InterruptedException {
        return acquire(config.timeoutMs());
    }

    @Override
    public Permit acquire(long timeoutMs) throws InterruptedException {
        lock.lock();
        try {
            if (active < config.maxConcurrent() && waiters.isEmpty()) {
                return grantLocked();
            }
            if (waiters.size() >= config.queueSize()) {
                throw new QueueFullException(waiters.size());
            }

            Waiter waiter = new Waiter(lock.newCondition());
            waiters.addLast(waiter);
            long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            try {
                while (waiter.permit == null && waiter.failure == null) {
                    if (remaining <= 0) {
                        waiters.remove(waiter);
                        timeouts++;
                        throw new AcquireTimeoutException(timeoutMs, waiters.size());
                    }
                    remaining = waiter.condition.awaitNanos(remaining);
                }
            } catch (InterruptedException e) {
                if (waiter.permit != null) {
                    waiter.permit.releaseLocked();
                } else {
                    waiters.remove(waiter);
                }
                throw e;
            }
            if (waiter.failure != null) {
                throw waiter.failure;
            }
            return waiter.permit;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getActiveCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getWaitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getAvailableCount() {
        lock.lock();
        try {
            return config.maxConcurrent() - active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConcurrencyMetrics getMetrics() {
        lock.lock();
        try {
            return new ConcurrencyMetrics(active, waiters.size(), maxReached, timeouts);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 모든 대기자를 {@code IllegalStateException("Semaphore reset")} 으로 실패시키고
     * permit 과 지표를 초기화합니다. 이전에 발급된 permit 의 반환은 무시됩니다.
     */
    @Override
    public void reset() {
        lock.lock();
        try {
            generation++;
            for (Waiter waiter : waiters) {
                waiter.failure = new IllegalStateException("Semaphore reset");
                waiter.condition.signal();
            }
            waiters.clear();
            active = 0;
            maxReached = 0;
            timeouts = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConcurrencyConfig getConfig() {
        return config;
    }

    private SemaphorePermit grantLocked() {
        active++;
        if (active > maxReached) {
            maxReached = active;
        }
        return new SemaphorePermit(generation);
    }

    /**
     * 대기 중인 acquire 호출.
     */
    private static final class Waiter {

        private final Condition condition;
        private SemaphorePermit permit;
        private IllegalStateException failure;

        private Waiter(Condition condition) {
            this.condition = condition;
        }
    }

    private final class SemaphorePermit implements Permit {

        private final long issuedGeneration;
        private final AtomicBoolean released = new AtomicBoolean();

        private SemaphorePermit(long issuedGeneration) {
            this.issuedGeneration = issuedGeneration;
        }

        @Override
        public void release() {
            if (!released.compareAndSet(false, true)) {
                log.warn("Semaphore permit released multiple times");
                return;
            }
            lock.lock();
            try {
                handOffLocked();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isReleased() {
            return released.get();
        }

        private void releaseLocked() {
            if (released.compareAndSet(false, true)) {
                handOffLocked();
            }
        }

        private void handOffLocked() {
            if (issuedGeneration != generation) {
                return;
            }
            Waiter next = waiters.pollFirst();
            if (next != null) {
                next.permit = new SemaphorePermit(generation);
                next.condition.signal();
            } else {
                active--;
            }
        }
    }
}
