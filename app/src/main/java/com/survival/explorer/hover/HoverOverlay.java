package com.survival.explorer.hover;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.highlight.HighlightMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Hover emphasis for one tree instance.
 * Holds only the currently hovered node id; nothing is shared between instances.
 */
public class HoverOverlay {

    private final TreeModel tree;
    private Integer hoveredNodeId;

    public HoverOverlay(TreeModel tree) {
        this.tree = tree == null ? TreeModel.empty() : tree;
    }

    /**
     * Pointer entered a node.
     *
     * @throws IllegalArgumentException if the node is not part of this tree
     */
    public void enter(int nodeId) {
        if (!tree.contains(nodeId)) {
            throw new IllegalArgumentException("Cannot hover unknown node " + nodeId);
        }
        hoveredNodeId = nodeId;
    }

    /**
     * Pointer left; clears the transient layer only.
     */
    public void leave() {
        hoveredNodeId = null;
    }

    public Optional<Integer> hoveredNode() {
        return Optional.ofNullable(hoveredNodeId);
    }

    /**
     * Ancestor chain of a node as a root-first path ending at the node itself.
     */
    public DecisionPath ancestorsOf(int nodeId) {
        if (!tree.contains(nodeId)) {
            throw new IllegalArgumentException("Unknown node " + nodeId);
        }
        List<Integer> chain = new ArrayList<>(tree.depthOf(nodeId) + 1);
        Integer current = nodeId;
        while (current != null) {
            chain.add(current);
            current = tree.parentOf(current).orElse(null);
        }
        Collections.reverse(chain);
        return new DecisionPath(chain);
    }

    /**
     * Layer the current hover chain over a persisted map.
     */
    public HighlightView overlay(HighlightMap persisted) {
        if (hoveredNodeId == null) {
            return HighlightView.of(persisted);
        }
        DecisionPath chain = ancestorsOf(hoveredNodeId);
        return new HighlightView(persisted, new HashSet<>(chain.nodeIds()), new HashSet<>(chain.edges()));
    }
}
