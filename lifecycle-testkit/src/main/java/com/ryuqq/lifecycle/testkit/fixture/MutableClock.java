package com.ryuqq.lifecycle.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} whose instant is set and advanced by the test.
 *
 * <p>Engine operations stamp phase entries and decisions with {@code clock.instant()};
 * tests use this clock to make those timestamps deterministic.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant instant;
    private final ZoneId zone;

    public MutableClock(Instant instant) {
        this(instant, ZoneOffset.UTC);
    }

    private MutableClock(Instant instant, ZoneId zone) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration the amount to advance (must not be negative)
     * @return the new instant
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
        instant = instant.plus(duration);
        return instant;
    }

    public void set(Instant newInstant) {
        if (newInstant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        instant = newInstant;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new MutableClock(instant, newZone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
