package com.ryuqq.resilience.testkit.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 테스트에서 직접 시간을 진행시키는 {@link Clock}.
 *
 * <p>여러 스레드에서 읽고 진행시켜도 안전합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ManualClock extends Clock {

    private final AtomicReference<Instant> now;

    public ManualClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = new AtomicReference<>(start);
    }

    public static ManualClock startingAt(long epochMillis) {
        return new ManualClock(Instant.ofEpochMilli(epochMillis));
    }

    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
        now.updateAndGet(instant -> instant.plus(duration));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void setTime(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public Instant instant() {
        return now.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
