package com.survival.explorer.highlight;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.Edge;
import com.survival.explorer.core.FeatureVector;
import com.survival.explorer.core.MissingFeatureException;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.dual.DualClass;
import com.survival.explorer.dual.DualPathResolver;
import com.survival.explorer.dual.DualResolution;
import com.survival.explorer.trace.HighlightMode;
import com.survival.explorer.trace.PathLimiter;
import com.survival.explorer.trace.PathTracer;

/**
 * Turns a tree and a highlight request into a complete {@link HighlightMap}.
 *
 * <p>Rules, applied on a map that starts with every tag NONE:
 * <ol>
 * <li>Idle: nothing is tagged.</li>
 * <li>Single, full path: path nodes and edges are ACTIVE and the leaf is final.</li>
 * <li>Single, partial path: the revealed prefix is TUTORIAL, no final marker.</li>
 * <li>Single: every tagged edge carries the outcome of the path's leaf.</li>
 * <li>Dual: the trunk is SHARED without outcome; each exclusive branch is
 * PATH_A / PATH_B with the outcome of its own leaf.</li>
 * </ol>
 * A missing feature or an incomplete comparison yields the idle map.
 */
public class HighlightStateBuilder {

    private final PathTracer tracer;
    private final PathLimiter limiter;
    private final DualPathResolver resolver;

    public HighlightStateBuilder() {
        this(new PathTracer(), new PathLimiter(), new DualPathResolver());
    }

    public HighlightStateBuilder(PathTracer tracer, PathLimiter limiter, DualPathResolver resolver) {
        this.tracer = tracer;
        this.limiter = limiter;
        this.resolver = resolver;
    }

    public HighlightMap build(TreeModel tree, HighlightRequest request) {
        if (tree == null || tree.isEmpty() || request == null) {
            return HighlightMap.idle(tree);
        }
        return switch (request.mode()) {
            case IDLE -> HighlightMap.idle(tree);
            case SINGLE -> buildSingle(tree, request.passenger(), request.highlightMode());
            case DUAL -> buildDual(tree, request.cohortA(), request.cohortB());
        };
    }

    private HighlightMap buildSingle(TreeModel tree, FeatureVector passenger, HighlightMode mode) {
        if (passenger == null) {
            System.err.println("[WARN] No passenger values supplied, showing idle tree");
            return HighlightMap.idle(tree);
        }

        DecisionPath fullPath;
        try {
            fullPath = tracer.trace(tree, passenger);
        } catch (MissingFeatureException e) {
            System.err.println("[WARN] Path highlight abandoned: " + e.getMessage());
            return HighlightMap.idle(tree);
        }

        DecisionPath shown = limiter.limit(fullPath, mode);
        boolean tutorial = mode.isTutorial();
        Identity identity = tutorial ? Identity.TUTORIAL : Identity.ACTIVE;
        // Edges preview where the whole path ends, not the class of the node they enter
        Outcome outcome = Outcome.ofClass(tree.node(fullPath.last()).predictedClass());

        HighlightMap.Builder builder = HighlightMap.builder(tree).tracedPath(fullPath);
        for (Integer id : shown.nodeIds()) {
            builder.node(id, identity);
        }
        for (Edge edge : tree.edges()) {
            if (shown.containsEdge(edge)) {
                builder.edge(edge, identity, outcome);
            }
        }
        if (!tutorial && !shown.isEmpty()) {
            builder.finalNode(shown.last());
        }
        return builder.build();
    }

    private HighlightMap buildDual(TreeModel tree, Cohort cohortA, Cohort cohortB) {
        if (cohortA == null || cohortB == null || cohortA.values() == null || cohortB.values() == null) {
            System.err.println("[WARN] Comparison needs two cohorts, showing idle tree");
            return HighlightMap.idle(tree);
        }

        DecisionPath pathA;
        DecisionPath pathB;
        try {
            pathA = tracer.trace(tree, cohortA.values());
            pathB = tracer.trace(tree, cohortB.values());
        } catch (MissingFeatureException e) {
            // Half a comparison is misleading, so drop both sides
            System.err.println("[WARN] Comparison abandoned: " + e.getMessage());
            return HighlightMap.idle(tree);
        }

        DualResolution resolution = resolver.resolve(pathA, pathB);
        Outcome outcomeA = Outcome.ofClass(tree.node(pathA.last()).predictedClass());
        Outcome outcomeB = Outcome.ofClass(tree.node(pathB.last()).predictedClass());

        HighlightMap.Builder builder = HighlightMap.builder(tree).resolution(resolution);
        for (Integer id : tree.nodeIds()) {
            builder.node(id, identityFor(resolution.classifyNode(id)));
        }
        for (Edge edge : tree.edges()) {
            DualClass dualClass = resolution.classifyEdge(edge);
            Outcome outcome = switch (dualClass) {
                case PATH_A -> outcomeA;
                case PATH_B -> outcomeB;
                default -> Outcome.NONE;
            };
            builder.edge(edge, identityFor(dualClass), outcome);
        }
        return builder.build();
    }

    private static Identity identityFor(DualClass dualClass) {
        return switch (dualClass) {
            case SHARED -> Identity.SHARED;
            case PATH_A -> Identity.PATH_A;
            case PATH_B -> Identity.PATH_B;
            case UNCLASSIFIED -> Identity.NONE;
        };
    }
}
