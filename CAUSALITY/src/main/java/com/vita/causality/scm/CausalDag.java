package com.vita.causality.scm;

import com.vita.causality.domain.model.CausalEdge;
import com.vita.causality.domain.model.EdgeType;
import com.vita.causality.domain.model.NodeType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Category-level causal graph built from persisted edges.
 * <p>
 * Edges with an unknown endpoint category, or whose direction {@link CausalDirection}
 * rejects, are left out of the adjacency.
 */
@Slf4j
public class CausalDag {

    private final Map<NodeType, List<Link>> adjacency;

    public CausalDag(List<CausalEdge> edges) {
        Map<NodeType, List<Link>> adj = new EnumMap<>(NodeType.class);
        int dropped = 0;
        for (CausalEdge edge : edges) {
            Optional<NodeType> source = edge.resolvedSourceType();
            Optional<NodeType> target = edge.resolvedTargetType();
            if (source.isEmpty() || target.isEmpty()
                    || !CausalDirection.canCause(source.get(), target.get())) {
                dropped++;
                continue;
            }
            adj.computeIfAbsent(source.get(), type -> new ArrayList<>())
                    .add(new Link(target.get(), edge.getEdgeType(), edge.getCausalStrength()));
        }
        if (dropped > 0) {
            log.debug("Excluded {} of {} edges from causal DAG", dropped, edges.size());
        }
        this.adjacency = adj;
    }

    /**
     * All simple paths from the given category to {@link NodeType#SYMPTOM}.
     */
    public List<List<NodeType>> tracePaths(NodeType from) {
        List<List<NodeType>> paths = new ArrayList<>();
        List<NodeType> current = new ArrayList<>();
        current.add(from);
        walk(from, current, paths);
        return paths;
    }

    /**
     * Product of edge weights along the path. A missing step contributes zero; paths
     * shorter than two nodes have no strength.
     */
    public double pathStrength(List<NodeType> path) {
        if (path.size() < 2) {
            return 0.0;
        }
        double strength = 1.0;
        for (int i = 0; i < path.size() - 1; i++) {
            NodeType to = path.get(i + 1);
            strength *= neighbors(path.get(i)).stream()
                    .filter(link -> link.target() == to)
                    .findFirst()
                    .map(Link::weight)
                    .orElse(0.0);
        }
        return strength;
    }

    public List<Link> neighbors(NodeType nodeType) {
        return Collections.unmodifiableList(adjacency.getOrDefault(nodeType, List.of()));
    }

    private void walk(NodeType current, List<NodeType> path, List<List<NodeType>> paths) {
        if (current == NodeType.SYMPTOM && path.size() > 1) {
            paths.add(List.copyOf(path));
            return;
        }
        for (Link link : neighbors(current)) {
            if (path.contains(link.target())) {
                continue;
            }
            path.add(link.target());
            walk(link.target(), path, paths);
            path.remove(path.size() - 1);
        }
    }

    /**
     * Outgoing adjacency entry.
     */
    public record Link(NodeType target, EdgeType edgeType, double weight) {
    }
}
