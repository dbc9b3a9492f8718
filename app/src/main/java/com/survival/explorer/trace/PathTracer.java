package com.survival.explorer.trace;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.FeatureVector;
import com.survival.explorer.core.MissingFeatureException;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.core.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Follows a feature vector from the root to a leaf.
 * At each split the left child is taken when {@code value <= threshold}.
 */
public class PathTracer {

    /**
     * Trace the root-to-leaf path for the given vector.
     * Only features tested along the taken path need a value; non-finite values count as missing.
     *
     * @return the path, or an empty path for an empty tree
     * @throws MissingFeatureException if a tested feature has no usable value
     */
    public DecisionPath trace(TreeModel tree, FeatureVector vector) {
        if (tree == null || tree.isEmpty()) {
            return DecisionPath.empty();
        }

        List<Integer> visited = new ArrayList<>(tree.maxDepth() + 1);
        TreeNode current = tree.root();
        while (true) {
            visited.add(current.id());
            if (current.isLeaf()) {
                break;
            }
            OptionalDouble value = vector == null ? OptionalDouble.empty() : vector.get(current.feature());
            // NaN compares false against every threshold, so it would silently go right
            if (value.isEmpty() || !Double.isFinite(value.getAsDouble())) {
                throw new MissingFeatureException(current.feature(), current.id());
            }
            int next = value.getAsDouble() <= current.threshold() ? current.leftChild() : current.rightChild();
            current = tree.node(next);
        }
        return new DecisionPath(visited);
    }
}
