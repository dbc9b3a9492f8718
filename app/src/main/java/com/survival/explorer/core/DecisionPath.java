package com.survival.explorer.core;

import java.util.*;

/**
 * Ordered node ids from the root towards a leaf.
 * Paths are derived values; they are never stored on the tree.
 */
public record DecisionPath(List<Integer> nodeIds) {

    private static final DecisionPath EMPTY = new DecisionPath(List.of());

    public DecisionPath {
        nodeIds = List.copyOf(nodeIds);
    }

    public static DecisionPath empty() {
        return EMPTY;
    }

    public static DecisionPath of(Integer... ids) {
        return new DecisionPath(Arrays.asList(ids));
    }

    public int size() {
        return nodeIds.size();
    }

    public boolean isEmpty() {
        return nodeIds.isEmpty();
    }

    public int get(int index) {
        return nodeIds.get(index);
    }

    /**
     * Id of the first node (the tree root for traced paths).
     */
    public int first() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty path");
        }
        return nodeIds.get(0);
    }

    /**
     * Id of the terminal node.
     */
    public int last() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty path");
        }
        return nodeIds.get(nodeIds.size() - 1);
    }

    public boolean contains(int id) {
        return nodeIds.contains(id);
    }

    /**
     * True when both endpoints of the edge lie on this path.
     */
    public boolean containsEdge(Edge edge) {
        return contains(edge.sourceId()) && contains(edge.targetId());
    }

    /**
     * The first {@code length} ids, clipped to the path's own length.
     */
    public DecisionPath prefix(int length) {
        if (length >= nodeIds.size()) {
            return this;
        }
        return new DecisionPath(nodeIds.subList(0, Math.max(0, length)));
    }

    /**
     * Consecutive id pairs as edges.
     */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        for (int i = 1; i < nodeIds.size(); i++) {
            result.add(new Edge(nodeIds.get(i - 1), nodeIds.get(i)));
        }
        return result;
    }

    public Set<Integer> idSet() {
        return new LinkedHashSet<>(nodeIds);
    }

    @Override
    public String toString() {
        return nodeIds.toString();
    }
}
