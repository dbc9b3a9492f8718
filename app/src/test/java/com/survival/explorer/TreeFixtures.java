package com.survival.explorer;

import com.survival.explorer.core.FeatureVector;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.core.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hand-built trees shared by the tests.
 */
public final class TreeFixtures {

    public static final String[] FEATURES = { "sex", "pclass", "age", "fare" };

    private TreeFixtures() {
    }

    /**
     * Root splits on sex: 1 = female leaf (survived), 2 = male leaf (died).
     */
    public static TreeModel sexSplit() {
        return TreeModel.of(List.of(
                TreeNode.split(0, "sex", 0.5, 1, 2, 300, 200).withLabels("female", "male"),
                TreeNode.leaf(1, 50, 150),
                TreeNode.leaf(2, 250, 50)));
    }

    /**
     * Seven nodes, depth 3.
     *
     * <pre>
     * 0 pclass <= 2.5
     * ├── 1 pclass <= 1.5
     * │   ├── 3 sex <= 0.5
     * │   │   ├── 5 leaf survived
     * │   │   └── 6 leaf died
     * │   └── 4 leaf survived (2nd class)
     * └── 2 leaf died (3rd class)
     * </pre>
     */
    public static TreeModel classThenSex() {
        return TreeModel.of(List.of(
                TreeNode.split(0, "pclass", 2.5, 1, 2, 400, 300),
                TreeNode.split(1, "pclass", 1.5, 3, 4, 120, 200),
                TreeNode.leaf(2, 280, 100),
                TreeNode.split(3, "sex", 0.5, 5, 6, 70, 130).withLabels("female", "male"),
                TreeNode.leaf(4, 50, 70),
                TreeNode.leaf(5, 5, 95),
                TreeNode.leaf(6, 65, 35)));
    }

    /**
     * Complete binary tree of the given depth. Node i has children 2i+1, 2i+2;
     * the split at depth d tests FEATURES[d % 4] against threshold 0.5.
     * Leaves alternate predicted class by id parity.
     */
    public static TreeModel complete(int depth) {
        List<TreeNode> nodes = new ArrayList<>();
        int internal = (1 << depth) - 1;
        int total = (1 << (depth + 1)) - 1;
        for (int id = 0; id < total; id++) {
            if (id < internal) {
                int level = 31 - Integer.numberOfLeadingZeros(id + 1);
                nodes.add(TreeNode.split(id, FEATURES[level % FEATURES.length], 0.5,
                        2 * id + 1, 2 * id + 2, 10, 10));
            } else if (id % 2 == 0) {
                nodes.add(TreeNode.leaf(id, 2, 8));
            } else {
                nodes.add(TreeNode.leaf(id, 8, 2));
            }
        }
        return TreeModel.of(nodes);
    }

    public static FeatureVector passenger(double sex, double pclass, double age, double fare) {
        return FeatureVector.of(Map.of("sex", sex, "pclass", pclass, "age", age, "fare", fare));
    }

    public static FeatureVector femaleFirstClass() {
        return passenger(0, 1, 30, 84.0);
    }

    public static FeatureVector maleFirstClass() {
        return passenger(1, 1, 30, 84.0);
    }
}
