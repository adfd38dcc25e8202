package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Directed, weighted, timestamped relation between two graph nodes.
 * <p>
 * Endpoint categories are carried explicitly; legacy edges without them fall back to
 * the node-ID prefix convention.
 */
@Value
public class CausalEdge {

    /** Store-assigned identifier, null until persisted */
    Long id;

    String sourceNodeId;

    String targetNodeId;

    NodeType sourceType;

    NodeType targetType;

    EdgeType edgeType;

    /** Learned causal strength (0.0 to 1.0) */
    double causalStrength;

    long temporalOffsetSeconds;

    /** Learned confidence (0.0 to 1.0), never decreases */
    double confidence;

    Instant createdAt;

    @Builder(toBuilder = true)
    private CausalEdge(Long id, String sourceNodeId, String targetNodeId, NodeType sourceType,
                       NodeType targetType, EdgeType edgeType, double causalStrength,
                       long temporalOffsetSeconds, double confidence, Instant createdAt) {
        this.id = id;
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
        this.sourceType = sourceType;
        this.targetType = targetType;
        this.edgeType = edgeType;
        this.causalStrength = Scores.clamp(causalStrength);
        this.temporalOffsetSeconds = temporalOffsetSeconds;
        this.confidence = Scores.clamp(confidence);
        this.createdAt = createdAt;
    }

    public Optional<NodeType> resolvedSourceType() {
        return sourceType != null ? Optional.of(sourceType) : NodeType.fromNodeId(sourceNodeId);
    }

    public Optional<NodeType> resolvedTargetType() {
        return targetType != null ? Optional.of(targetType) : NodeType.fromNodeId(targetNodeId);
    }
}
