package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A screen-time or activity episode.
 */
@Value
@Builder(toBuilder = true)
public class BehavioralEvent {

    Long id;

    Instant timestamp;

    Duration duration;

    Category category;

    String appName;

    /** Dopamine debt score (0-100), absent when not computed */
    Double dopamineDebtScore;

    public boolean isPassive() {
        return category == Category.PASSIVE_CONSUMPTION || category == Category.ZOMBIE_SCROLLING;
    }

    public double minutes() {
        return duration == null ? 0.0 : duration.toMillis() / 60_000.0;
    }

    public enum Category {
        ACTIVE_WORK,
        PASSIVE_CONSUMPTION,
        ZOMBIE_SCROLLING,
        STRESS_SIGNAL,
        EXERCISE,
        REST
    }
}
