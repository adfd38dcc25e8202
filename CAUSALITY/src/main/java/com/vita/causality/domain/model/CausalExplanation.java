package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Final output unit of a reasoning session.
 */
@Value
public class CausalExplanation {

    String symptom;

    List<String> causalChain;

    /** Category-level score from classification (0.0 to 1.0) */
    double strength;

    /** Confidence of the winning hypothesis or rule (0.0 to 1.0) */
    double confidence;

    String narrative;

    @Builder
    @Jacksonized
    private CausalExplanation(String symptom, List<String> causalChain, double strength,
                              double confidence, String narrative) {
        this.symptom = symptom;
        this.causalChain = causalChain != null ? List.copyOf(causalChain) : List.of();
        this.strength = Scores.clamp(strength);
        this.confidence = Scores.clamp(confidence);
        this.narrative = narrative;
    }
}
