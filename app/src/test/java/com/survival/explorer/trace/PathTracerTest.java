package com.survival.explorer.trace;

import com.survival.explorer.TreeFixtures;
import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.FeatureVector;
import com.survival.explorer.core.MissingFeatureException;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.core.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathTracerTest {

    private final PathTracer tracer = new PathTracer();

    @Test
    void testSingleSplitOnSex() {
        TreeModel tree = TreeFixtures.sexSplit();

        assertEquals(DecisionPath.of(0, 1), tracer.trace(tree, FeatureVector.parse("sex=0")));
        assertEquals(DecisionPath.of(0, 2), tracer.trace(tree, FeatureVector.parse("sex=1")));
    }

    @Test
    void testThresholdIsInclusiveOnTheLeft() {
        TreeModel tree = TreeFixtures.sexSplit();
        assertEquals(DecisionPath.of(0, 1), tracer.trace(tree, FeatureVector.parse("sex=0.5")));
        assertEquals(DecisionPath.of(0, 2), tracer.trace(tree, FeatureVector.parse("sex=0.5000001")));
    }

    @Test
    void testDeterminism() {
        TreeModel tree = TreeFixtures.complete(4);
        FeatureVector v = TreeFixtures.passenger(1, 0, 45, 0.2);
        assertEquals(tracer.trace(tree, v), tracer.trace(tree, v));
    }

    @Test
    void testPathValidity() {
        TreeModel tree = TreeFixtures.complete(4);
        FeatureVector v = TreeFixtures.femaleFirstClass();

        DecisionPath path = tracer.trace(tree, v);

        assertEquals(List.of(0, 1, 4, 10, 22), path.nodeIds());
        assertEquals(tree.root().id(), path.first());
        assertTrue(tree.node(path.last()).isLeaf());
        for (int i = 0; i + 1 < path.size(); i++) {
            TreeNode node = tree.node(path.get(i));
            assertTrue(node.children().contains(path.get(i + 1)), "Consecutive ids must be parent/child");

            double value = v.get(node.feature()).getAsDouble();
            int expected = value <= node.threshold() ? node.leftChild() : node.rightChild();
            assertEquals(expected, path.get(i + 1));
        }
    }

    @Test
    void testOnlyTestedFeaturesAreRequired() {
        // sex is the only feature tested on the way to leaf 1
        TreeModel tree = TreeFixtures.sexSplit();
        assertEquals(2, tracer.trace(tree, FeatureVector.parse("sex=0")).size());
    }

    @Test
    void testMissingFeature() {
        TreeModel tree = TreeFixtures.classThenSex();

        MissingFeatureException e = assertThrows(MissingFeatureException.class,
                () -> tracer.trace(tree, FeatureVector.parse("pclass=1")));
        assertEquals("sex", e.getFeature());
        assertEquals(3, e.getNodeId());

        // Third class never reaches the sex split
        assertEquals(DecisionPath.of(0, 2), tracer.trace(tree, FeatureVector.parse("pclass=3")));
    }

    @Test
    void testNonFiniteValuesCountAsMissing() {
        TreeModel tree = TreeFixtures.classThenSex();

        MissingFeatureException nan = assertThrows(MissingFeatureException.class,
                () -> tracer.trace(tree, FeatureVector.parse("pclass=NaN,sex=0")));
        assertEquals("pclass", nan.getFeature());

        MissingFeatureException infinite = assertThrows(MissingFeatureException.class,
                () -> tracer.trace(tree, FeatureVector.parse("pclass=1,sex=Infinity")));
        assertEquals("sex", infinite.getFeature());
    }

    @Test
    void testNullVectorOnNonTrivialTree() {
        assertThrows(MissingFeatureException.class, () -> tracer.trace(TreeFixtures.sexSplit(), null));
    }

    @Test
    void testEmptyTree() {
        assertTrue(tracer.trace(TreeModel.empty(), FeatureVector.empty()).isEmpty());
        assertTrue(tracer.trace(null, FeatureVector.empty()).isEmpty());
    }

    @Test
    void testSingleLeafTree() {
        TreeModel tree = TreeModel.of(List.of(TreeNode.leaf(5, 1, 3)));
        assertEquals(DecisionPath.of(5), tracer.trace(tree, FeatureVector.empty()));
    }
}
