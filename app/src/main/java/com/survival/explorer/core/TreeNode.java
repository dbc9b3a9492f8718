package com.survival.explorer.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A single node of a binary decision tree.
 * Children are referenced by id and resolved through {@link TreeModel}.
 * The record itself does not enforce leaf/internal consistency; that is
 * checked when the node is assembled into a {@link TreeModel}.
 */
public record TreeNode(
        /** Stable id, unique within the tree */
        int id,

        /** True for terminal nodes */
        boolean isLeaf,

        /** Feature tested at this node (null for leaves) */
        String feature,

        /** Split threshold, left branch taken when value <= threshold (null for leaves) */
        Double threshold,

        /** Child ids as [left, right] (empty for leaves) */
        List<Integer> children,

        /** Training samples reaching this node */
        int samples,

        /** Samples that died */
        int classCount0,

        /** Samples that survived */
        int classCount1,

        /** Majority class (0 = died, 1 = survived) */
        int predictedClass,

        /** Label of the left branch, e.g. "female" */
        String leftLabel,

        /** Label of the right branch, e.g. "male" */
        String rightLabel) {

    public TreeNode {
        children = children == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Create a leaf, predicting the majority class of its counts.
     */
    public static TreeNode leaf(int id, int classCount0, int classCount1) {
        return new TreeNode(id, true, null, null, List.of(),
                classCount0 + classCount1, classCount0, classCount1,
                majorityClass(classCount0, classCount1), null, null);
    }

    /**
     * Create an internal split node.
     */
    public static TreeNode split(int id, String feature, double threshold, int left, int right,
            int classCount0, int classCount1) {
        return new TreeNode(id, false, feature, threshold, List.of(left, right),
                classCount0 + classCount1, classCount0, classCount1,
                majorityClass(classCount0, classCount1), null, null);
    }

    public static int majorityClass(int classCount0, int classCount1) {
        return classCount1 > classCount0 ? 1 : 0;
    }

    public TreeNode withLabels(String left, String right) {
        return new TreeNode(id, isLeaf, feature, threshold, children, samples,
                classCount0, classCount1, predictedClass, left, right);
    }

    /**
     * Probability of survival at this node.
     */
    public double probability() {
        return samples == 0 ? 0.0 : (double) classCount1 / samples;
    }

    public int leftChild() {
        return children.get(0);
    }

    public int rightChild() {
        return children.get(1);
    }

    /**
     * Human-readable split rule or prediction, e.g. "sex <= 0.50".
     */
    public String splitRule() {
        if (isLeaf) {
            return predictedClass == 1 ? "Survived" : "Died";
        }
        return String.format(Locale.ROOT, "%s <= %.2f", feature, threshold);
    }
}
