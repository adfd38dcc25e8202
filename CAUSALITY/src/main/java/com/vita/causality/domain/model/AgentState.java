package com.vita.causality.domain.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable state of a single reasoning session. Never shared between sessions.
 */
public class AgentState {

    @Getter
    private final String sessionId;

    @Getter
    private final String symptom;

    @Getter
    private final TimeWindow analysisWindow;

    private final List<Hypothesis> hypotheses = new ArrayList<>();

    private final List<ToolObservation> observations = new ArrayList<>();

    @Getter
    private boolean resolved;

    public AgentState(String sessionId, String symptom, TimeWindow analysisWindow) {
        this.sessionId = sessionId;
        this.symptom = symptom;
        this.analysisWindow = analysisWindow;
    }

    /**
     * Replace the hypothesis set, keeping it sorted by descending confidence.
     */
    public void setHypotheses(List<Hypothesis> updated) {
        hypotheses.clear();
        hypotheses.addAll(updated);
        resort();
    }

    public void resort() {
        hypotheses.sort(Hypothesis.MOST_CONFIDENT_FIRST);
    }

    public List<Hypothesis> getHypotheses() {
        return Collections.unmodifiableList(hypotheses);
    }

    public Optional<Hypothesis> topHypothesis() {
        return hypotheses.isEmpty() ? Optional.empty() : Optional.of(hypotheses.get(0));
    }

    public void addObservation(ToolObservation observation) {
        observations.add(observation);
    }

    public List<ToolObservation> getObservations() {
        return Collections.unmodifiableList(observations);
    }

    public Set<String> investigatedTools() {
        return observations.stream()
                .map(ToolObservation::getToolName)
                .collect(Collectors.toSet());
    }

    public void markResolved() {
        this.resolved = true;
    }
}
