package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.exception.AcquireTimeoutException;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.protection.ConcurrencyConfig;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter.Permit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link ConcurrencyLimiter} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Exact permit accounting and idempotent release</li>
 *   <li>FIFO hand-off to waiters, no barging by tryAcquire</li>
 *   <li>Wait-list limit, timeout and interrupt behavior</li>
 *   <li>Reset fails waiters and makes old permits inert</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class ConcurrencyLimiterContract extends AbstractContractTest {

    /**
     * Creates the limiter under test.
     *
     * @param config limiter configuration
     * @return a fresh limiter with all permits available
     */
    protected abstract ConcurrencyLimiter createLimiter(ConcurrencyConfig config);

    private ConcurrencyLimiter createLimiter(int maxConcurrent, int queueSize) {
        return createLimiter(new ConcurrencyConfig(maxConcurrent, queueSize, 5_000));
    }

    private Thread acquireInBackground(ConcurrencyLimiter limiter, String name, List<String> order,
                                       AtomicReference<Throwable> error) {
        return startThread(name, () -> {
            try {
                Permit permit = limiter.acquire(5_000);
                order.add(name);
                permit.release();
            } catch (Throwable t) {
                error.set(t);
            }
        });
    }

    @Test
    void testTryAcquire_ExactAccounting() {
        // Given
        ConcurrencyLimiter limiter = createLimiter(2, 10);

        // When
        Permit first = limiter.tryAcquire();
        Permit second = limiter.tryAcquire();
        Permit third = limiter.tryAcquire();

        // Then
        assertNotNull(first);
        assertNotNull(second);
        assertNull(third, "No permit beyond maxConcurrent");
        assertEquals(2, limiter.getActiveCount());
        assertEquals(0, limiter.getAvailableCount());

        first.release();
        assertEquals(1, limiter.getActiveCount());
        assertEquals(1, limiter.getAvailableCount());
    }

    @Test
    void testRelease_IsIdempotent() {
        // Given
        ConcurrencyLimiter limiter = createLimiter(2, 10);
        Permit first = limiter.tryAcquire();
        limiter.tryAcquire();

        // When
        first.release();
        first.release();

        // Then
        assertTrue(first.isReleased());
        assertEquals(1, limiter.getActiveCount(), "Second release must not free capacity twice");
    }

    @Test
    void testMaxReached_TracksHighWaterMark() {
        // Given
        ConcurrencyLimiter limiter = createLimiter(3, 10);

        // When
        Permit a = limiter.tryAcquire();
        Permit b = limiter.tryAcquire();
        a.release();
        b.release();

        // Then
        assertEquals(2, limiter.getMetrics().maxReached());
        assertEquals(0, limiter.getMetrics().active());
    }

    @Test
    void testAcquire_FifoHandOff() throws InterruptedException {
        // Given
        ConcurrencyLimiter limiter = createLimiter(1, 10);
        Permit held = limiter.tryAcquire();
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicReference<Throwable> error = new AtomicReference<>();

        Thread first = acquireInBackground(limiter, "first", order, error);
        awaitCondition("first waiter", () -> limiter.getWaitingCount() == 1, 2_000);
        Thread second = acquireInBackground(limiter, "second", order, error);
        awaitCondition("second waiter", () -> limiter.getWaitingCount() == 2, 2_000);

        // When
        held.release();
        first.join(2_000);
        second.join(2_000);

        // Then
        assertNull(error.get());
        assertEquals(List.of("first", "second"), order);
        assertEquals(0, limiter.getActiveCount());
    }

    @Test
    void testTryAcquire_DoesNotBargeAheadOfWaiters() {
        // Given
        ConcurrencyLimiter limiter = createLimiter(1, 10);
        Permit held = limiter.tryAcquire();
        AtomicReference<Permit> waiterPermit = new AtomicReference<>();
        startThread("waiter", () -> {
            try {
                waiterPermit.set(limiter.acquire(5_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        awaitCondition("waiter enqueued", () -> limiter.getWaitingCount() == 1, 2_000);

        // When
        held.release();

        // Then
        assertNull(limiter.tryAcquire(), "Freed permit belongs to the waiter");
        awaitCondition("waiter granted", () -> waiterPermit.get() != null, 2_000);
        assertEquals(1, limiter.getActiveCount());
        waiterPermit.get().release();
        assertEquals(0, limiter.getActiveCount());
    }

    @Test
    void testAcquire_WaitListFull_ThrowsImmediately() {
        // Given
        ConcurrencyLimiter limiter = createLimiter(1, 1);
        limiter.tryAcquire();
        startThread("waiter", () -> {
            try {
                limiter.acquire(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        awaitCondition("waiter enqueued", () -> limiter.getWaitingCount() == 1, 2_000);

        // When
        QueueFullException exception = assertThrows(QueueFullException.class, () -> limiter.acquire(5_000));

        // Then
        assertEquals(1, exception.getQueueSize());
        assertNull(exception.getPriority());
        assertEquals(1, limiter.getWaitingCount());
    }

    @Test
    void testAcquire_ZeroQueueSize_RejectsWhenSaturated() {
        // Given
        ConcurrencyLimiter limiter = createLimiter(1, 0);
        limiter.tryAcquire();

        // When & Then
        assertThrows(QueueFullException.class, () -> limiter.acquire(1_000));
    }

    @Test
    void testAcquire_Timeout() {
        // Given
        ConcurrencyLimiter limiter = createLimiter(1, 10);
        limiter.tryAcquire();

        // When
        AcquireTimeoutException exception = assertThrows(
            AcquireTimeoutException.class,
            () -> limiter.acquire(50)
        );

        // Then
        assertEquals(50, exception.getTimeoutMs());
        assertEquals(0, limiter.getWaitingCount(), "Timed-out waiter leaves the wait list");
        assertEquals(1, limiter.getMetrics().timeouts());
        assertEquals(1, limiter.getActiveCount());
    }

    @Test
    void testAcquire_Interrupted_LeavesNothingHeld() throws InterruptedException {
        // Given
        ConcurrencyLimiter limiter = createLimiter(1, 10);
        Permit held = limiter.tryAcquire();
        AtomicReference<Throwable> error = new AtomicReference<>();
        Thread waiter = startThread("waiter", () -> {
            try {
                limiter.acquire(5_000);
            } catch (Throwable t) {
                error.set(t);
            }
        });
        awaitCondition("waiter enqueued", () -> limiter.getWaitingCount() == 1, 2_000);

        // When
        waiter.interrupt();
        waiter.join(2_000);

        // Then
        assertInstanceOf(InterruptedException.class, error.get());
        assertEquals(0, limiter.getWaitingCount());
        held.release();
        assertEquals(0, limiter.getActiveCount());
    }

    @Test
    void testReset_FailsWaitersAndInvalidatesOldPermits() throws InterruptedException {
        // Given
        ConcurrencyLimiter limiter = createLimiter(1, 10);
        Permit old = limiter.tryAcquire();
        AtomicReference<Throwable> error = new AtomicReference<>();
        Thread waiter = startThread("waiter", () -> {
            try {
                limiter.acquire(5_000);
            } catch (Throwable t) {
                error.set(t);
            }
        });
        awaitCondition("waiter enqueued", () -> limiter.getWaitingCount() == 1, 2_000);

        // When
        limiter.reset();
        waiter.join(2_000);

        // Then
        assertInstanceOf(IllegalStateException.class, error.get());
        assertEquals("Semaphore reset", error.get().getMessage());
        assertEquals(0, limiter.getActiveCount());

        Permit fresh = limiter.tryAcquire();
        assertNotNull(fresh);
        old.release();
        assertEquals(1, limiter.getActiveCount(), "Permit issued before reset is inert");
        fresh.release();
        assertEquals(0, limiter.getActiveCount());
    }
}
