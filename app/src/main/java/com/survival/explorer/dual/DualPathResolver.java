package com.survival.explorer.dual;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.MalformedTreeException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits two cohort paths into shared and exclusive segments.
 */
public class DualPathResolver {

    /**
     * Resolve two paths traced through the same tree.
     *
     * @throws MalformedTreeException if both paths are non-empty but start at
     *                                different roots
     */
    public DualResolution resolve(DecisionPath pathA, DecisionPath pathB) {
        if (!pathA.isEmpty() && !pathB.isEmpty() && pathA.first() != pathB.first()) {
            throw new MalformedTreeException(
                    "Paths start at different roots: " + pathA.first() + " vs " + pathB.first());
        }

        Set<Integer> idsA = new HashSet<>(pathA.nodeIds());
        Set<Integer> idsB = new HashSet<>(pathB.nodeIds());

        List<Integer> shared = new ArrayList<>();
        List<Integer> uniqueA = new ArrayList<>();
        for (Integer id : pathA.nodeIds()) {
            if (idsB.contains(id)) {
                if (!shared.contains(id))
                    shared.add(id);
            } else if (!uniqueA.contains(id)) {
                uniqueA.add(id);
            }
        }

        List<Integer> uniqueB = new ArrayList<>();
        for (Integer id : pathB.nodeIds()) {
            if (!idsA.contains(id) && !uniqueB.contains(id)) {
                uniqueB.add(id);
            }
        }

        return new DualResolution(pathA, pathB, shared, uniqueA, uniqueB);
    }
}
