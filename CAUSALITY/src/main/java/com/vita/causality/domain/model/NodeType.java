package com.vita.causality.domain.model;

import java.util.Optional;

/**
 * Causal node categories, declared in their fixed topological order.
 */
public enum NodeType {
    MEAL("meal_"),
    ENVIRONMENTAL("environment_"),
    BEHAVIORAL("behavioral_"),
    GLUCOSE("glucose_"),
    PHYSIOLOGICAL("physio_"),
    SYMPTOM("symptom_");

    private final String idPrefix;

    NodeType(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /**
     * Build a node identifier for this category.
     */
    public String nodeId(Object key) {
        return idPrefix + key;
    }

    /**
     * Infer the category of a legacy node identifier from its prefix.
     */
    public static Optional<NodeType> fromNodeId(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        for (NodeType type : values()) {
            if (nodeId.startsWith(type.idPrefix)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
