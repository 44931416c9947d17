package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.metrics.CircuitBreakerMetrics;
import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CircuitBreaker} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN after exactly failureThreshold consecutive failures</li>
 *   <li>OPEN → HALF_OPEN once the OPEN timeout has elapsed</li>
 *   <li>HALF_OPEN → CLOSED after successThreshold successes, → OPEN on any failure</li>
 *   <li>Probe limit, stale outcomes and listener isolation</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class CircuitBreakerContract extends AbstractContractTest {

    private static final long OPEN_TIMEOUT_MS = 1_000;

    /**
     * Creates the circuit breaker under test.
     *
     * @param config breaker configuration
     * @param clock time source
     * @param listener event listener
     * @return a CLOSED circuit breaker
     */
    protected abstract CircuitBreaker createCircuitBreaker(CircuitBreakerConfig config, Clock clock,
                                                           ResilienceListener listener);

    private CircuitBreaker createCircuitBreaker(int failureThreshold, int successThreshold, int halfOpenMax) {
        return createCircuitBreaker(
            new CircuitBreakerConfig(failureThreshold, successThreshold, OPEN_TIMEOUT_MS, halfOpenMax), clock, listener);
    }

    private static void failOnce(CircuitBreaker breaker) {
        assertThrows(IOException.class, () -> breaker.execute(() -> {
            throw new IOException("backend down");
        }));
    }

    private static void succeedOnce(CircuitBreaker breaker) throws Exception {
        assertEquals("ok", breaker.execute(() -> "ok"));
    }

    private void trip(CircuitBreaker breaker) {
        for (int i = 0; i < breaker.getConfig().failureThreshold(); i++) {
            failOnce(breaker);
        }
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
    }

    @Test
    void testOpens_AtExactlyFailureThreshold() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(3, 2, 1);
        AtomicInteger invocations = new AtomicInteger();

        // When
        for (int i = 0; i < 2; i++) {
            failOnce(breaker);
        }
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        failOnce(breaker);

        // Then
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertTrue(breaker.isOpen());
        assertFalse(breaker.allowsExecution());
        CircuitOpenException rejected = assertThrows(
            CircuitOpenException.class,
            () -> breaker.execute(invocations::incrementAndGet)
        );
        assertEquals(0, invocations.get(), "Rejected call must not be invoked");
        assertEquals(OPEN_TIMEOUT_MS, rejected.getRetryAfterMs());
        assertEquals(List.of("open:3"), listener.events());

        CircuitBreakerMetrics metrics = breaker.getMetrics();
        assertEquals(1, metrics.totalOpens());
        assertEquals(START.toEpochMilli(), metrics.lastFailureAt());
    }

    @Test
    void testSuccess_ResetsConsecutiveFailures() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(3, 2, 1);
        failOnce(breaker);
        failOnce(breaker);

        // When
        succeedOnce(breaker);
        failOnce(breaker);
        failOnce(breaker);

        // Then
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getMetrics().failures());
    }

    @Test
    void testHalfOpen_AfterTimeout() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(1, 1, 1);
        trip(breaker);

        // When
        clock.advanceMillis(OPEN_TIMEOUT_MS - 1);
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(1, breaker.getTimeUntilCloseMs());
        clock.advanceMillis(1);

        // Then
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.allowsExecution());
        assertEquals(0, breaker.getTimeUntilCloseMs());
        assertEquals(List.of("open:1", "half-open"), listener.events());
    }

    @Test
    void testHalfOpen_ClosesAfterSuccessThreshold() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(2, 2, 3);
        trip(breaker);
        clock.advanceMillis(OPEN_TIMEOUT_MS);

        // When
        succeedOnce(breaker);
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        succeedOnce(breaker);

        // Then
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getMetrics().failures());
        assertEquals(List.of("open:2", "half-open", "close"), listener.events());
    }

    @Test
    void testHalfOpen_FailureReopens() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(1, 2, 3);
        trip(breaker);
        clock.advanceMillis(OPEN_TIMEOUT_MS);
        succeedOnce(breaker);

        // When
        failOnce(breaker);

        // Then
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(2, breaker.getMetrics().totalOpens());
        assertEquals(OPEN_TIMEOUT_MS, breaker.getTimeUntilCloseMs(), "OPEN timeout restarts");
    }

    @Test
    void testHalfOpen_LimitsConcurrentProbes() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(1, 5, 2);
        trip(breaker);
        clock.advanceMillis(OPEN_TIMEOUT_MS);

        // When
        CallPermission first = breaker.acquirePermission();
        CallPermission second = breaker.tryAcquirePermission();

        // Then
        assertNotNull(second);
        assertNull(breaker.tryAcquirePermission());
        assertFalse(breaker.allowsExecution());
        assertThrows(CircuitOpenException.class, breaker::acquirePermission);

        first.release();
        assertTrue(breaker.allowsExecution(), "Released probe slot is available again");
        second.onSuccess();
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
    }

    @Test
    void testStaleOutcome_IsIgnored() {
        // Given: two calls admitted while CLOSED
        CircuitBreaker breaker = createCircuitBreaker(1, 1, 1);
        CallPermission first = breaker.acquirePermission();
        CallPermission late = breaker.acquirePermission();

        // When
        first.onFailure(new IOException("down"));
        clock.advanceMillis(OPEN_TIMEOUT_MS);
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        late.onSuccess();

        // Then
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState(),
            "Success admitted under CLOSED must not close a HALF_OPEN circuit");
    }

    @Test
    void testPermission_IsSingleUse() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(2, 1, 1);
        CallPermission permission = breaker.acquirePermission();

        // When
        permission.onFailure(new IOException("down"));
        permission.onFailure(new IOException("down"));

        // Then
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(1, breaker.getMetrics().failures());
    }

    @Test
    void testExecute_RethrowsOperationExceptionUnchanged() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(5, 1, 1);
        IOException cause = new IOException("original");

        // When
        IOException thrown = assertThrows(IOException.class, () -> breaker.execute(() -> {
            throw cause;
        }));

        // Then
        assertSame(cause, thrown);
    }

    @Test
    void testForceOpen_AndReset() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(5, 1, 1);

        // When
        breaker.forceOpen();

        // Then
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(1, breaker.getMetrics().totalOpens());

        breaker.reset();
        CircuitBreakerMetrics metrics = breaker.getMetrics();
        assertEquals(CircuitBreakerState.CLOSED, metrics.state());
        assertEquals(0, metrics.totalOpens());
        assertEquals(0, metrics.failures());
        assertNull(metrics.lastFailureAt());
        assertTrue(breaker.allowsExecution());
    }

    @Test
    void testListenerFailure_DoesNotAffectBreaker() {
        // Given
        ResilienceListener throwing = new ResilienceListener() {
            @Override
            public void onCircuitOpen(int failures) {
                throw new IllegalStateException("listener bug");
            }
        };
        CircuitBreaker breaker = createCircuitBreaker(new CircuitBreakerConfig(1, 1, OPEN_TIMEOUT_MS, 1), clock, throwing);

        // When
        failOnce(breaker);

        // Then
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
    }
}
