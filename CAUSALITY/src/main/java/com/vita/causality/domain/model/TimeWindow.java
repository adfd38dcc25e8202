package com.vita.causality.domain.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Closed time range used for every health-data query.
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + to);
        }
    }

    public static TimeWindow ending(Instant end, Duration length) {
        return new TimeWindow(end.minus(length), end);
    }

    public static TimeWindow lastHours(Clock clock, long hours) {
        return ending(clock.instant(), Duration.ofHours(hours));
    }

    /**
     * A window of the given length that ends where this one starts, used for baselines.
     */
    public TimeWindow precedingBy(Duration length) {
        return new TimeWindow(from.minus(length), from);
    }

    public TimeWindow extendBackBy(Duration length) {
        return new TimeWindow(from.minus(length), to);
    }

    public Duration length() {
        return Duration.between(from, to);
    }
}
