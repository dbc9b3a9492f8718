package com.survival.explorer.highlight;

import com.survival.explorer.TreeFixtures;
import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.Edge;
import com.survival.explorer.core.FeatureVector;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.dual.DualResolution;
import com.survival.explorer.trace.HighlightMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HighlightStateBuilderTest {

    private final HighlightStateBuilder builder = new HighlightStateBuilder();

    @Test
    void testIdleTagsNothing() {
        TreeModel tree = TreeFixtures.classThenSex();
        HighlightMap map = builder.build(tree, HighlightRequest.idle());

        assertTrue(map.isIdle());
        assertEquals(7, map.nodeTags().size(), "Every node should carry an explicit tag");
        assertEquals(6, map.edgeTags().size());
    }

    @Test
    void testEmptyOrNullTree() {
        assertTrue(builder.build(null, HighlightRequest.single(TreeFixtures.femaleFirstClass())).isIdle());
        assertTrue(builder.build(TreeModel.empty(), HighlightRequest.single(TreeFixtures.femaleFirstClass())).isIdle());
        assertTrue(builder.build(TreeFixtures.sexSplit(), null).isIdle());
    }

    @Test
    void testSingleFullPath() {
        TreeModel tree = TreeFixtures.classThenSex();
        HighlightMap map = builder.build(tree, HighlightRequest.single(TreeFixtures.femaleFirstClass()));

        assertEquals(List.of(0, 1, 3, 5), map.nodesWith(Identity.ACTIVE));
        assertEquals(Identity.NONE, map.identityOf(2));
        assertEquals(List.of(new Edge(0, 1), new Edge(1, 3), new Edge(3, 5)), map.edgesWith(Identity.ACTIVE));
        assertEquals(Optional.of(5), map.finalNode());
        assertTrue(map.isFinal(5));
        for (Edge edge : map.edgesWith(Identity.ACTIVE)) {
            assertEquals(Outcome.SURVIVED, map.outcomeOf(edge));
        }
        assertEquals(Outcome.NONE, map.outcomeOf(new Edge(0, 2)));
    }

    @Test
    void testOutcomeComesFromTerminalLeaf() {
        // Node 1 leans survived, but the male path ends in a died leaf
        TreeModel tree = TreeFixtures.classThenSex();
        HighlightMap map = builder.build(tree, HighlightRequest.single(TreeFixtures.maleFirstClass()));

        assertEquals(1, tree.node(1).predictedClass());
        assertEquals(Outcome.DIED, map.outcomeOf(new Edge(0, 1)));
        assertEquals(Outcome.DIED, map.outcomeOf(new Edge(3, 6)));
    }

    @Test
    void testFirstSplitIsTutorial() {
        TreeModel tree = TreeFixtures.classThenSex();
        HighlightMap map = builder.build(tree,
                HighlightRequest.single(TreeFixtures.femaleFirstClass(), HighlightMode.FIRST_SPLIT));

        assertEquals(List.of(0, 1), map.nodesWith(Identity.TUTORIAL));
        assertTrue(map.nodesWith(Identity.ACTIVE).isEmpty());
        assertEquals(List.of(new Edge(0, 1)), map.edgesWith(Identity.TUTORIAL));
        assertEquals(Outcome.SURVIVED, map.outcomeOf(new Edge(0, 1)), "Tutorial edges preview the final leaf");
        assertTrue(map.finalNode().isEmpty(), "No final marker while revealing");
    }

    @Test
    void testDepthRevealCoveringWholePathStillTutorial() {
        TreeModel tree = TreeFixtures.classThenSex();
        HighlightMap map = builder.build(tree,
                HighlightRequest.single(TreeFixtures.femaleFirstClass(), HighlightMode.depth(10)));

        assertEquals(List.of(0, 1, 3, 5), map.nodesWith(Identity.TUTORIAL));
        assertTrue(map.finalNode().isEmpty());
    }

    @Test
    void testDepthZeroRevealsOnlyRoot() {
        HighlightMap map = builder.build(TreeFixtures.classThenSex(),
                HighlightRequest.single(TreeFixtures.femaleFirstClass(), HighlightMode.depth(0)));
        assertEquals(List.of(0), map.nodesWith(Identity.TUTORIAL));
        assertTrue(map.edgesWith(Identity.TUTORIAL).isEmpty());
    }

    @Test
    void testMissingFeatureFallsBackToIdle() {
        HighlightMap map = builder.build(TreeFixtures.classThenSex(),
                HighlightRequest.single(FeatureVector.parse("pclass=1")));
        assertTrue(map.isIdle());
    }

    @Test
    void testDualComparison() {
        TreeModel tree = TreeFixtures.classThenSex();
        HighlightMap map = builder.build(tree, HighlightRequest.dual(
                Cohort.of("Women, 1st class", TreeFixtures.femaleFirstClass()),
                Cohort.of("Men, 1st class", TreeFixtures.maleFirstClass())));

        assertEquals(List.of(0, 1, 3), map.nodesWith(Identity.SHARED));
        assertEquals(List.of(5), map.nodesWith(Identity.PATH_A));
        assertEquals(List.of(6), map.nodesWith(Identity.PATH_B));

        assertEquals(new EdgeTag(Identity.SHARED, Outcome.NONE), map.tagOf(new Edge(0, 1)));
        assertEquals(new EdgeTag(Identity.SHARED, Outcome.NONE), map.tagOf(new Edge(1, 3)));
        assertEquals(new EdgeTag(Identity.PATH_A, Outcome.SURVIVED), map.tagOf(new Edge(3, 5)));
        assertEquals(new EdgeTag(Identity.PATH_B, Outcome.DIED), map.tagOf(new Edge(3, 6)));
        assertEquals(EdgeTag.NONE, map.tagOf(new Edge(0, 2)));
        assertTrue(map.finalNode().isEmpty());
    }

    @Test
    void testEveryExclusiveEdgeCarriesItsBranchOutcome() {
        TreeModel tree = TreeFixtures.complete(4);
        // A ends in leaf 15 (odd, died); B ends in leaf 30 (even, survived)
        HighlightMap map = builder.build(tree, HighlightRequest.dual(
                Cohort.of("A", TreeFixtures.passenger(0, 0, 0, 0)),
                Cohort.of("B", TreeFixtures.passenger(1, 1, 1, 1))));

        assertEquals(4, map.edgesWith(Identity.PATH_A).size());
        for (Edge edge : map.edgesWith(Identity.PATH_A)) {
            assertEquals(Outcome.DIED, map.outcomeOf(edge), edge.toString());
        }
        assertEquals(4, map.edgesWith(Identity.PATH_B).size());
        for (Edge edge : map.edgesWith(Identity.PATH_B)) {
            assertEquals(Outcome.SURVIVED, map.outcomeOf(edge), edge.toString());
        }
    }

    @Test
    void testIdenticalCohortsRenderAsShared() {
        TreeModel tree = TreeFixtures.complete(4);
        FeatureVector profile = TreeFixtures.femaleFirstClass();
        HighlightMap map = builder.build(tree, HighlightRequest.dual(
                Cohort.of("A", profile), Cohort.of("B", FeatureVector.of(profile.asMap()))));

        assertEquals(List.of(0, 1, 4, 10, 22), map.nodesWith(Identity.SHARED));
        assertEquals(4, map.edgesWith(Identity.SHARED).size());
        assertTrue(map.nodesWith(Identity.PATH_A).isEmpty());
        assertTrue(map.nodesWith(Identity.PATH_B).isEmpty());
        for (Edge edge : map.edgesWith(Identity.SHARED)) {
            assertEquals(Outcome.NONE, map.outcomeOf(edge));
        }
    }

    @Test
    void testDualWithOneInvalidCohortIsIdle() {
        TreeModel tree = TreeFixtures.classThenSex();

        HighlightMap missingFeature = builder.build(tree, HighlightRequest.dual(
                Cohort.of("A", TreeFixtures.femaleFirstClass()),
                Cohort.of("B", FeatureVector.parse("pclass=1"))));
        assertTrue(missingFeature.isIdle(), "Half a comparison must not be shown");

        HighlightMap missingCohort = builder.build(tree, HighlightRequest.dual(
                Cohort.of("A", TreeFixtures.femaleFirstClass()), null));
        assertTrue(missingCohort.isIdle());
    }

    @Test
    void testDualWithNaNCohortIsIdle() {
        HighlightMap map = builder.build(TreeFixtures.classThenSex(), HighlightRequest.dual(
                Cohort.of("A", TreeFixtures.femaleFirstClass()),
                Cohort.of("B", FeatureVector.parse("sex=NaN,pclass=NaN"))));

        assertTrue(map.isIdle());
        assertTrue(map.resolution().isEmpty());
    }

    @Test
    void testSingleWithNaNValueIsIdle() {
        HighlightMap map = builder.build(TreeFixtures.classThenSex(),
                HighlightRequest.single(FeatureVector.parse("pclass=NaN,sex=0")));
        assertTrue(map.isIdle());
        assertTrue(map.tracedPath().isEmpty());
    }

    @Test
    void testMapKeepsWhatItWasComputedFrom() {
        TreeModel tree = TreeFixtures.classThenSex();

        HighlightMap tutorial = builder.build(tree,
                HighlightRequest.single(TreeFixtures.femaleFirstClass(), HighlightMode.FIRST_SPLIT));
        assertEquals(Optional.of(DecisionPath.of(0, 1, 3, 5)), tutorial.tracedPath(),
                "The full path is kept even when only a prefix is tagged");
        assertTrue(tutorial.resolution().isEmpty());

        HighlightMap dual = builder.build(tree, HighlightRequest.dual(
                Cohort.of("A", TreeFixtures.femaleFirstClass()),
                Cohort.of("B", TreeFixtures.maleFirstClass())));
        DualResolution resolution = dual.resolution().orElseThrow();
        assertEquals(List.of(0, 1, 3), resolution.shared());
        assertEquals(List.of(5), resolution.uniqueA());
        assertEquals(List.of(6), resolution.uniqueB());
        assertTrue(dual.tracedPath().isEmpty());
    }

    @Test
    void testSwitchingSingleToDualLeavesNoResidue() {
        TreeModel tree = TreeFixtures.classThenSex();
        HighlightMap single = builder.build(tree, HighlightRequest.single(TreeFixtures.femaleFirstClass()));
        HighlightMap dual = builder.build(tree, HighlightRequest.dual(
                Cohort.of("A", TreeFixtures.femaleFirstClass()),
                Cohort.of("B", TreeFixtures.maleFirstClass())));

        assertTrue(dual.nodesWith(Identity.ACTIVE).isEmpty());
        assertTrue(dual.edgesWith(Identity.ACTIVE).isEmpty());
        assertTrue(dual.finalNode().isEmpty());

        HighlightDiff diff = dual.diff(single);
        assertTrue(diff.changedNodes().containsAll(List.of(0, 1, 3, 5, 6)));
        assertFalse(diff.changedNodes().contains(2));
        assertFalse(diff.changedEdges().contains(new Edge(0, 2)));
    }

    @Test
    void testDiffAgainstItselfIsEmpty() {
        TreeModel tree = TreeFixtures.sexSplit();
        HighlightMap map = builder.build(tree, HighlightRequest.single(FeatureVector.parse("sex=1")));
        assertTrue(map.diff(map).isEmpty());
        assertFalse(map.diff(null).isEmpty());
    }
}
