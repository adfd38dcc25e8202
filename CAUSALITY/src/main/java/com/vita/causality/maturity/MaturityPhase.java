package com.vita.causality.maturity;

/**
 * Operating phase of the engine, from pure rule-based behavior to full iterative reasoning.
 */
public enum MaturityPhase {
    /** Collecting data; too little for any statistical reasoning */
    PASSIVE("Collecting your data"),
    /** Enough data for correlations, edges not yet trusted */
    CORRELATION("Finding patterns"),
    /** Edges trusted; iterative reasoning enabled */
    CAUSAL("Understanding causes"),
    /** Long history; language-model narratives enabled */
    ACTIVE("Personalized insights");

    private final String displayName;

    MaturityPhase(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
