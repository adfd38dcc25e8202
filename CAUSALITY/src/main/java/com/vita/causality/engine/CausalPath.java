package com.vita.causality.engine;

import com.vita.causality.domain.model.NodeType;

import java.util.List;

/**
 * A category path ending at the symptom node, with the product of its edge weights.
 */
public record CausalPath(List<NodeType> nodes, double strength) {

    public CausalPath {
        nodes = List.copyOf(nodes);
    }
}
