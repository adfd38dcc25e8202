package com.vita.causality.domain.model;

/**
 * Helpers for unit-interval scores.
 */
public final class Scores {

    private Scores() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
