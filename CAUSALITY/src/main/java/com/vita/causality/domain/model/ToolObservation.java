package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one evidence-gathering step. Positive evidence supports a category,
 * negative evidence contradicts it.
 */
@Value
public class ToolObservation {

    String toolName;

    Map<DebtType, Double> evidence;

    /** Tool-reported reliability (0.0 to 1.0) */
    double confidence;

    String detail;

    @Builder
    private ToolObservation(String toolName, Map<DebtType, Double> evidence, double confidence, String detail) {
        this.toolName = toolName;
        this.evidence = evidence == null || evidence.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(evidence));
        this.confidence = Scores.clamp(confidence);
        this.detail = detail != null ? detail : "";
    }

    public Optional<Double> evidenceFor(DebtType debtType) {
        return Optional.ofNullable(evidence.get(debtType));
    }
}
