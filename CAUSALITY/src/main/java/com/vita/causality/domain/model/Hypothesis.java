package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A scored claim that a debt category explains the reported symptom.
 * <p>
 * Lives for one reasoning session. Only confidence and the evidence logs change after
 * construction; confidence is clamped to [0, 1] on every write.
 */
@ToString
public class Hypothesis implements Comparable<Hypothesis> {

    public static final Comparator<Hypothesis> MOST_CONFIDENT_FIRST = Comparator.reverseOrder();

    @Getter
    private final DebtType debtType;

    @Getter
    private final String description;

    @Getter
    private double confidence;

    private final List<String> causalChain;

    private final List<String> supportingEvidence;

    private final List<String> contradictingEvidence;

    @Getter
    private final double priorProbability;

    @Builder
    private Hypothesis(DebtType debtType,
                       String description,
                       double confidence,
                       List<String> causalChain,
                       List<String> supportingEvidence,
                       double priorProbability) {
        this.debtType = debtType;
        this.description = description;
        this.confidence = Scores.clamp(confidence);
        this.causalChain = causalChain != null ? List.copyOf(causalChain) : List.of();
        this.supportingEvidence = supportingEvidence != null ? new ArrayList<>(supportingEvidence) : new ArrayList<>();
        this.contradictingEvidence = new ArrayList<>();
        this.priorProbability = Scores.clamp(priorProbability);
    }

    public void setConfidence(double confidence) {
        this.confidence = Scores.clamp(confidence);
    }

    public void addSupportingEvidence(String entry) {
        supportingEvidence.add(entry);
    }

    public void addContradictingEvidence(String entry) {
        contradictingEvidence.add(entry);
    }

    public List<String> getCausalChain() {
        return causalChain;
    }

    public List<String> getSupportingEvidence() {
        return Collections.unmodifiableList(supportingEvidence);
    }

    public List<String> getContradictingEvidence() {
        return Collections.unmodifiableList(contradictingEvidence);
    }

    @Override
    public int compareTo(Hypothesis other) {
        return Double.compare(confidence, other.confidence);
    }
}
