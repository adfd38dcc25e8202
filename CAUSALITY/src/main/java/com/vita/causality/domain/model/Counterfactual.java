package com.vita.causality.domain.model;

/**
 * A templated "what if" intervention.
 */
public record Counterfactual(String description, double impact, Effort effort, double confidence) {

    public Counterfactual {
        impact = Scores.clamp(impact);
        confidence = Scores.clamp(confidence);
    }

    public enum Effort {
        TRIVIAL, MODERATE, SIGNIFICANT
    }
}
