package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.event.IsolatingListener;
import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.exception.RateLimitExceededException;
import com.ryuqq.resilience.core.metrics.RateLimiterMetrics;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;

import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token Bucket 기반 {@link RateLimiter} 구현.
 *
 * <p>버킷은 최대 {@code bucketSize} 개의 토큰을 담고, 초당 {@code refillRate} 개씩 채워집니다.
 * 별도 타이머 없이 호출 시점에 경과 시간으로 토큰을 계산합니다:</p>
 * <pre>
 * tokens = min(bucketSize, tokens + elapsedSeconds * refillRate)
 * </pre>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>{@code tryAcquire}: 토큰이 있으면 차감, 없으면 즉시 false</li>
 *   <li>{@code acquire}: 토큰이 찰 때까지 호출 스레드를 대기시킴.
 *       필요한 대기 시간이 남은 제한 시간을 넘으면 대기 없이 즉시
 *       {@link RateLimitExceededException}</li>
 * </ul>
 *
 * <p>모든 상태는 하나의 {@link ReentrantLock} 으로 보호됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class TokenBucket implements RateLimiter {

    private final RateLimiterConfig config;
    private final Clock clock;
    private final ResilienceListener listener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition refilled = lock.newCondition();

    private double tokens;
    private long lastRefillAt;
    private long requestsThrottled;
    private long totalWaitTimeMs;

    public TokenBucket(RateLimiterConfig config) {
        this(config, Clock.systemUTC(), ResilienceListener.NONE);
    }

    /**
     * TokenBucket 생성.
     *
     * @param config 버킷 설정
     * @param clock 시간 소스
     * @param listener throttle 이벤트 리스너 (예외는 격리됨)
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public TokenBucket(RateLimiterConfig config, Clock clock, ResilienceListener listener) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.listener = IsolatingListener.wrap(listener);
        this.tokens = config.bucketSize();
        this.lastRefillAt = clock.millis();
    }

    @Override
    public boolean tryAcquire(int requested) {
        validate(requested);
        lock.lock();
        try {
            refill();
            if (tokens >= requested) {
                tokens -= requested;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void acquire(int requested, long timeoutMs) throws InterruptedException {
        validate(requested);
        long waitedMs;
        lock.lock();
        try {
            refill();
            if (tokens >= requested) {
                tokens -= requested;
                return;
            }
            if (requested > config.bucketSize()) {
                throw exceeded(requested);
            }

            long startNanos = System.nanoTime();
            long deadline = startNanos + TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMs));
            while (tokens < requested) {
                long neededMs = millisUntil(requested);
                long remainingNanos = deadline - System.nanoTime();
                if (TimeUnit.MILLISECONDS.toNanos(neededMs) > remainingNanos) {
                    throw exceeded(requested);
                }
                refilled.awaitNanos(TimeUnit.MILLISECONDS.toNanos(neededMs));
                refill();
            }
            tokens -= requested;

            waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            requestsThrottled++;
            totalWaitTimeMs += waitedMs;
        } finally {
            lock.unlock();
        }
        listener.onThrottle(waitedMs);
    }

    @Override
    public int getAvailableTokens() {
        lock.lock();
        try {
            refill();
            return (int) Math.floor(tokens);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getTimeUntilNextTokenMs() {
        lock.lock();
        try {
            refill();
            return millisUntil(1);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterMetrics getMetrics() {
        lock.lock();
        try {
            refill();
            double avgWait = requestsThrottled == 0 ? 0.0 : (double) totalWaitTimeMs / requestsThrottled;
            return new RateLimiterMetrics((int) Math.floor(tokens), requestsThrottled, avgWait);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            tokens = config.bucketSize();
            lastRefillAt = clock.millis();
            requestsThrottled = 0;
            totalWaitTimeMs = 0;
            refilled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillAt;
        if (elapsed > 0) {
            tokens = Math.min(config.bucketSize(), tokens + (elapsed / 1000.0) * config.refillRate());
            lastRefillAt = now;
        }
    }

    private long millisUntil(int requested) {
        double missing = requested - tokens;
        if (missing <= 0) {
            return 0;
        }
        return (long) Math.ceil(missing / config.refillRate() * 1000.0);
    }

    private RateLimitExceededException exceeded(int requested) {
        return new RateLimitExceededException(requested, (int) Math.floor(tokens), millisUntil(requested));
    }

    private static void validate(int requested) {
        if (requested <= 0) {
            throw new IllegalArgumentException("tokens must be positive (current: " + requested + ")");
        }
    }
}
