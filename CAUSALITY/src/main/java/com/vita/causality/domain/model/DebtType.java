package com.vita.causality.domain.model;

/**
 * Root-cause categories a symptom can be attributed to.
 */
public enum DebtType {
    /** Food driven: glucose spikes and crashes, post-meal HRV suppression. */
    METABOLIC("metabolic"),
    /** Behavior driven: passive scrolling, dopamine debt. */
    DIGITAL("digital"),
    /** Context driven: environment, sleep deprivation. */
    SOMATIC("somatic");

    private final String label;

    DebtType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
