package com.survival.explorer.dual;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.Edge;

import java.util.List;
import java.util.Set;

/**
 * Partition of two traced paths into a shared trunk and two exclusive branches.
 * {@code shared} keeps path A's order; the unique lists keep their own path's order.
 */
public record DualResolution(
        DecisionPath pathA,
        DecisionPath pathB,
        List<Integer> shared,
        List<Integer> uniqueA,
        List<Integer> uniqueB) {

    public DualResolution {
        shared = List.copyOf(shared);
        uniqueA = List.copyOf(uniqueA);
        uniqueB = List.copyOf(uniqueB);
    }

    public boolean isIdentical() {
        return uniqueA.isEmpty() && uniqueB.isEmpty();
    }

    /**
     * Classify a node by its membership.
     */
    public DualClass classifyNode(int id) {
        if (shared.contains(id))
            return DualClass.SHARED;
        if (uniqueA.contains(id))
            return DualClass.PATH_A;
        if (uniqueB.contains(id))
            return DualClass.PATH_B;
        return DualClass.UNCLASSIFIED;
    }

    /**
     * Classify an edge. An edge belongs to a branch when both endpoints lie on
     * that branch's path and its target is exclusive to it, which also covers
     * the divergence edge leaving the shared trunk.
     */
    public DualClass classifyEdge(Edge edge) {
        int source = edge.sourceId();
        int target = edge.targetId();
        if (shared.contains(source) && shared.contains(target)) {
            return DualClass.SHARED;
        }
        if (pathA.contains(source) && pathA.contains(target) && uniqueA.contains(target)) {
            return DualClass.PATH_A;
        }
        if (pathB.contains(source) && pathB.contains(target) && uniqueB.contains(target)) {
            return DualClass.PATH_B;
        }
        return DualClass.UNCLASSIFIED;
    }

    /**
     * Id where the two paths split, i.e. the last shared node, or -1 when
     * nothing is shared.
     */
    public int divergenceNode() {
        return shared.isEmpty() ? -1 : shared.get(shared.size() - 1);
    }

    public Set<Integer> sharedSet() {
        return Set.copyOf(shared);
    }
}
