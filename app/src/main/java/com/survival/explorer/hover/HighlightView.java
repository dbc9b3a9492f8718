package com.survival.explorer.hover;

import com.survival.explorer.core.Edge;
import com.survival.explorer.highlight.HighlightMap;

import java.util.Set;

/**
 * Persisted highlight tags with the transient hover layer on top.
 * The hover layer never alters the persisted tags.
 */
public record HighlightView(HighlightMap persisted, Set<Integer> hoverNodes, Set<Edge> hoverEdges) {

    public HighlightView {
        hoverNodes = Set.copyOf(hoverNodes);
        hoverEdges = Set.copyOf(hoverEdges);
    }

    public static HighlightView of(HighlightMap persisted) {
        return new HighlightView(persisted, Set.of(), Set.of());
    }

    public boolean isHovered(int nodeId) {
        return hoverNodes.contains(nodeId);
    }

    public boolean isHovered(Edge edge) {
        return hoverEdges.contains(edge);
    }

    public boolean hasHover() {
        return !hoverNodes.isEmpty();
    }
}
