package com.ryuqq.tokenflow.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deterministic clock for contract tests.
 *
 * <p>Every {@link #instant()} call returns the current instant and then advances it by
 * a fixed step, so consecutive transitions get strictly increasing timestamps.
 * {@link #setInstant(Instant)} moves the clock to an arbitrary point, including
 * backwards, to exercise the non-decreasing updatedAt rule.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SteppingClock extends Clock {

    private final AtomicReference<Instant> current;
    private final Duration step;
    private final ZoneId zone;

    /**
     * Creates a UTC clock.
     *
     * @param start first instant returned
     * @param step advance applied after each read (zero or positive)
     * @throws IllegalArgumentException if start or step is invalid
     */
    public SteppingClock(Instant start, Duration step) {
        this(start, step, ZoneOffset.UTC);
    }

    private SteppingClock(Instant start, Duration step, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        if (step == null || step.isNegative()) {
            throw new IllegalArgumentException("step cannot be null or negative (current: " + step + ")");
        }
        this.current = new AtomicReference<>(start);
        this.step = step;
        this.zone = zone;
    }

    @Override
    public Instant instant() {
        return current.getAndUpdate(instant -> instant.plus(step));
    }

    /**
     * Returns the next instant without advancing.
     *
     * @return the instant the next {@link #instant()} call will return
     */
    public Instant peek() {
        return current.get();
    }

    /**
     * Moves the clock.
     *
     * @param instant next instant to return
     */
    public void setInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        current.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new SteppingClock(current.get(), step, zone);
    }
}
