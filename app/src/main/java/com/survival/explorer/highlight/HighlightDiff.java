package com.survival.explorer.highlight;

import com.survival.explorer.core.Edge;

import java.util.Set;

/**
 * Nodes and edges whose tags changed between two highlight maps.
 */
public record HighlightDiff(Set<Integer> changedNodes, Set<Edge> changedEdges) {

    public HighlightDiff {
        changedNodes = Set.copyOf(changedNodes);
        changedEdges = Set.copyOf(changedEdges);
    }

    public boolean isEmpty() {
        return changedNodes.isEmpty() && changedEdges.isEmpty();
    }
}
