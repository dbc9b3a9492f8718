package com.survival.explorer.report;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.core.TreeNode;
import com.survival.explorer.dual.DualResolution;

import java.util.Locale;

/**
 * Fixed-width console tables describing traced paths.
 */
public class PathReporter {

    private static final String ROW = "| %-4s | %-5s | %-18s | %-16s | %-7s | %-7s |%n";

    /**
     * One row per node on the path.
     */
    public String formatPath(TreeModel tree, DecisionPath path) {
        StringBuilder out = new StringBuilder();
        header(out, "Step", "Node", "Rule", "Branch", "Samples", "P(surv)");
        for (int i = 0; i < path.size(); i++) {
            TreeNode node = tree.node(path.get(i));
            String branch = i + 1 < path.size() ? branchLabel(node, path.get(i + 1)) : "";
            row(out, String.valueOf(i), node, branch);
        }
        out.append(verdict(tree, path));
        return out.toString();
    }

    /**
     * Both cohort paths, marking each node as shared or exclusive.
     */
    public String formatComparison(TreeModel tree, DualResolution resolution, String labelA, String labelB) {
        StringBuilder out = new StringBuilder();
        header(out, "Side", "Node", "Rule", "Branch", "Samples", "P(surv)");
        for (Integer id : resolution.shared()) {
            row(out, "both", tree.node(id), nextBranch(tree, resolution.pathA(), id));
        }
        for (Integer id : resolution.uniqueA()) {
            row(out, "A", tree.node(id), nextBranch(tree, resolution.pathA(), id));
        }
        for (Integer id : resolution.uniqueB()) {
            row(out, "B", tree.node(id), nextBranch(tree, resolution.pathB(), id));
        }
        out.append(labelA).append(": ").append(verdict(tree, resolution.pathA()));
        out.append(labelB).append(": ").append(verdict(tree, resolution.pathB()));
        return out.toString();
    }

    private void header(StringBuilder out, Object... columns) {
        out.append(String.format(ROW, columns));
        out.append("|").append("-".repeat(6)).append("|").append("-".repeat(7)).append("|")
                .append("-".repeat(20)).append("|").append("-".repeat(18)).append("|")
                .append("-".repeat(9)).append("|").append("-".repeat(9)).append("|").append(System.lineSeparator());
    }

    private void row(StringBuilder out, String first, TreeNode node, String branch) {
        out.append(String.format(Locale.ROOT, ROW,
                first,
                node.id(),
                truncate(node.splitRule(), 18),
                truncate(branch, 16),
                node.samples(),
                String.format(Locale.ROOT, "%.3f", node.probability())));
    }

    private String nextBranch(TreeModel tree, DecisionPath path, int id) {
        int index = path.nodeIds().indexOf(id);
        if (index < 0 || index + 1 >= path.size()) {
            return "";
        }
        return branchLabel(tree.node(id), path.get(index + 1));
    }

    private String branchLabel(TreeNode node, int childId) {
        boolean left = node.leftChild() == childId;
        String label = left ? node.leftLabel() : node.rightLabel();
        if (label != null) {
            return label;
        }
        return String.format(Locale.ROOT, "%s %s %.2f", node.feature(), left ? "<=" : ">", node.threshold());
    }

    private String verdict(TreeModel tree, DecisionPath path) {
        if (path.isEmpty()) {
            return "No path" + System.lineSeparator();
        }
        TreeNode leaf = tree.node(path.last());
        return String.format(Locale.ROOT, "%s (%.1f%% survival, leaf %d)%n",
                leaf.predictedClass() == 1 ? "SURVIVED" : "DIED", leaf.probability() * 100, leaf.id());
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }
}
