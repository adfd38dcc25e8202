package com.vita.causality.scm;

import com.vita.causality.domain.model.NodeType;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed domain knowledge about causal direction. Not learnable.
 * <p>
 * A category may cause itself or any category after it in {@link #CAUSAL_ORDER}, unless the
 * pair is listed in {@link #FORBIDDEN}.
 */
public final class CausalDirection {

    public static final List<NodeType> CAUSAL_ORDER = List.of(
            NodeType.MEAL,
            NodeType.ENVIRONMENTAL,
            NodeType.BEHAVIORAL,
            NodeType.GLUCOSE,
            NodeType.PHYSIOLOGICAL,
            NodeType.SYMPTOM
    );

    /** Cause category mapped to the categories it can never directly cause */
    public static final Map<NodeType, Set<NodeType>> FORBIDDEN = Map.of(
            // Digital behavior does not move glucose directly
            NodeType.BEHAVIORAL, Set.of(NodeType.GLUCOSE),
            // Reverse-causation trap
            NodeType.SYMPTOM, Set.of(NodeType.MEAL),
            NodeType.ENVIRONMENTAL, Set.of(NodeType.BEHAVIORAL)
    );

    private CausalDirection() {
    }

    public static boolean isForbidden(NodeType source, NodeType target) {
        return FORBIDDEN.getOrDefault(source, Set.of()).contains(target);
    }

    public static boolean canCause(NodeType source, NodeType target) {
        int sourceIndex = CAUSAL_ORDER.indexOf(source);
        int targetIndex = CAUSAL_ORDER.indexOf(target);
        if (sourceIndex < 0 || targetIndex < 0) {
            return false;
        }
        return sourceIndex <= targetIndex && !isForbidden(source, target);
    }
}
