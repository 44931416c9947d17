package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.exception.RateLimitExceededException;
import com.ryuqq.resilience.core.metrics.RateLimiterMetrics;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link RateLimiter} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Burst absorption up to bucketSize</li>
 *   <li>Refill of k tokens after k / refillRate seconds, capped at bucketSize</li>
 *   <li>Fail-fast when the required wait exceeds the timeout</li>
 *   <li>Reset and metrics</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class RateLimiterContract extends AbstractContractTest {

    /**
     * Creates the rate limiter under test.
     *
     * @param config limiter configuration
     * @param clock time source
     * @param listener event listener
     * @return a fresh, full rate limiter
     */
    protected abstract RateLimiter createRateLimiter(RateLimiterConfig config, Clock clock, ResilienceListener listener);

    private RateLimiter createRateLimiter(int bucketSize, double refillRate) {
        return createRateLimiter(new RateLimiterConfig(bucketSize, refillRate), clock, listener);
    }

    @Test
    void testBurst_AbsorbsExactlyBucketSize() {
        // Given
        RateLimiter limiter = createRateLimiter(5, 1);

        // When
        int accepted = 0;
        for (int i = 0; i < 6; i++) {
            if (limiter.tryAcquire()) {
                accepted++;
            }
        }

        // Then
        assertEquals(5, accepted, "A full bucket should admit exactly bucketSize calls");
        assertEquals(0, limiter.getAvailableTokens());
    }

    @Test
    void testRefill_AddsTokensProportionalToElapsedTime() {
        // Given
        RateLimiter limiter = createRateLimiter(10, 2);
        assertTrue(limiter.tryAcquire(10));

        // When: 1.5s at 2 tokens/s
        clock.advanceMillis(1_500);

        // Then
        assertEquals(3, limiter.getAvailableTokens());
        assertTrue(limiter.tryAcquire(3));
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void testRefill_NeverExceedsCapacity() {
        // Given
        RateLimiter limiter = createRateLimiter(4, 10);
        limiter.tryAcquire(4);

        // When
        clock.advanceMillis(60_000);

        // Then
        assertEquals(4, limiter.getAvailableTokens());
        assertEquals(4, limiter.getMetrics().tokensAvailable());
    }

    @Test
    void testFractionalRate_TimeUntilNextToken() {
        // Given: one token every two seconds
        RateLimiter limiter = createRateLimiter(1, 0.5);
        limiter.tryAcquire();

        // When
        clock.advanceMillis(1_000);

        // Then
        assertEquals(0, limiter.getAvailableTokens(), "Half a token is floored to zero");
        assertEquals(1_000, limiter.getTimeUntilNextTokenMs());
        clock.advanceMillis(1_000);
        assertEquals(0, limiter.getTimeUntilNextTokenMs());
        assertTrue(limiter.tryAcquire());
    }

    @Test
    void testAcquire_FailsFastWhenWaitExceedsTimeout() {
        // Given
        RateLimiter limiter = createRateLimiter(1, 1);
        limiter.tryAcquire();

        // When
        long start = System.nanoTime();
        RateLimitExceededException exception = assertThrows(
            RateLimitExceededException.class,
            () -> limiter.acquire(1, 100)
        );
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        // Then
        assertEquals(1, exception.getRequested());
        assertEquals(0, exception.getTokensAvailable());
        assertEquals(1_000, exception.getRefillInMs());
        assertTrue(exception.isRetryable());
        assertTrue(elapsedMs < 1_000, "Should not sleep when the wait cannot fit in the timeout");
    }

    @Test
    void testAcquire_MoreThanCapacity_FailsImmediately() {
        // Given
        RateLimiter limiter = createRateLimiter(3, 100);

        // When & Then
        assertThrows(RateLimitExceededException.class, () -> limiter.acquire(4, 10_000));
        assertEquals(3, limiter.getAvailableTokens(), "A rejected acquire must not consume tokens");
    }

    @Test
    void testAcquire_TokensAvailable_DoesNotThrottle() throws InterruptedException {
        // Given
        RateLimiter limiter = createRateLimiter(2, 1);

        // When
        limiter.acquire(1_000);
        limiter.acquire(1, 1_000);

        // Then
        RateLimiterMetrics metrics = limiter.getMetrics();
        assertEquals(0, metrics.requestsThrottled());
        assertEquals(0.0, metrics.avgWaitTimeMs());
        assertTrue(listener.events().isEmpty());
    }

    @Test
    void testInvalidTokenCount_Throws() {
        // Given
        RateLimiter limiter = createRateLimiter(3, 1);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire(0));
        assertThrows(IllegalArgumentException.class, () -> limiter.acquire(-1, 100));
    }

    @Test
    void testReset_RefillsBucket() {
        // Given
        RateLimiter limiter = createRateLimiter(5, 1);
        limiter.tryAcquire(5);

        // When
        limiter.reset();

        // Then
        assertEquals(5, limiter.getAvailableTokens());
        assertEquals(0, limiter.getMetrics().requestsThrottled());
        assertEquals(5, limiter.getConfig().bucketSize());
    }
}
