package com.survival.explorer.highlight;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.Edge;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.dual.DualResolution;

import java.util.*;

/**
 * Per-node identity tags and per-edge identity/outcome tags for one tree.
 * Instances are immutable; every recomputation produces a new map.
 */
public final class HighlightMap {

    private static final HighlightMap EMPTY =
            new HighlightMap(new LinkedHashMap<>(), new LinkedHashMap<>(), null, null, null);

    private final Map<Integer, Identity> nodes;
    private final Map<Edge, EdgeTag> edges;
    private final Integer finalNodeId;
    private final DecisionPath tracedPath;
    private final DualResolution resolution;

    private HighlightMap(LinkedHashMap<Integer, Identity> nodes, LinkedHashMap<Edge, EdgeTag> edges,
            Integer finalNodeId, DecisionPath tracedPath, DualResolution resolution) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableMap(edges);
        this.finalNodeId = finalNodeId;
        this.tracedPath = tracedPath;
        this.resolution = resolution;
    }

    /**
     * Map with every node and edge of the tree tagged NONE.
     */
    public static HighlightMap idle(TreeModel tree) {
        if (tree == null || tree.isEmpty()) {
            return EMPTY;
        }
        return builder(tree).build();
    }

    /**
     * Builder pre-filled with NONE for every node and edge of the tree.
     */
    static Builder builder(TreeModel tree) {
        return new Builder(tree);
    }

    public Identity identityOf(int nodeId) {
        return nodes.getOrDefault(nodeId, Identity.NONE);
    }

    public EdgeTag tagOf(Edge edge) {
        return edges.getOrDefault(edge, EdgeTag.NONE);
    }

    public Identity identityOf(Edge edge) {
        return tagOf(edge).identity();
    }

    public Outcome outcomeOf(Edge edge) {
        return tagOf(edge).outcome();
    }

    /**
     * True for the terminal node of a fully revealed single path.
     */
    public boolean isFinal(int nodeId) {
        return finalNodeId != null && finalNodeId == nodeId;
    }

    public Optional<Integer> finalNode() {
        return Optional.ofNullable(finalNodeId);
    }

    /**
     * Full traced path behind a single-passenger map, even when only a prefix is tagged.
     */
    public Optional<DecisionPath> tracedPath() {
        return Optional.ofNullable(tracedPath);
    }

    /**
     * Cohort split behind a comparison map.
     */
    public Optional<DualResolution> resolution() {
        return Optional.ofNullable(resolution);
    }

    public Map<Integer, Identity> nodeTags() {
        return nodes;
    }

    public Map<Edge, EdgeTag> edgeTags() {
        return edges;
    }

    public List<Integer> nodesWith(Identity identity) {
        return nodes.entrySet().stream()
                .filter(e -> e.getValue() == identity)
                .map(Map.Entry::getKey)
                .toList();
    }

    public List<Edge> edgesWith(Identity identity) {
        return edges.entrySet().stream()
                .filter(e -> e.getValue().identity() == identity)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * True when nothing is highlighted.
     */
    public boolean isIdle() {
        return finalNodeId == null
                && nodes.values().stream().allMatch(i -> i == Identity.NONE)
                && edges.values().stream().allMatch(EdgeTag.NONE::equals);
    }

    /**
     * Nodes and edges whose tags differ from {@code previous}, so a renderer
     * can patch only what changed. A null previous map counts as all NONE.
     */
    public HighlightDiff diff(HighlightMap previous) {
        HighlightMap before = previous == null ? EMPTY : previous;

        Set<Integer> changedNodes = new LinkedHashSet<>();
        Set<Integer> nodeIds = new LinkedHashSet<>(nodes.keySet());
        nodeIds.addAll(before.nodes.keySet());
        for (Integer id : nodeIds) {
            if (identityOf(id) != before.identityOf(id) || isFinal(id) != before.isFinal(id)) {
                changedNodes.add(id);
            }
        }

        Set<Edge> changedEdges = new LinkedHashSet<>();
        Set<Edge> edgeKeys = new LinkedHashSet<>(edges.keySet());
        edgeKeys.addAll(before.edges.keySet());
        for (Edge edge : edgeKeys) {
            if (!tagOf(edge).equals(before.tagOf(edge))) {
                changedEdges.add(edge);
            }
        }
        return new HighlightDiff(changedNodes, changedEdges);
    }

    /**
     * Single-use builder; the map is assembled once and then frozen.
     */
    static final class Builder {
        private final LinkedHashMap<Integer, Identity> nodes = new LinkedHashMap<>();
        private final LinkedHashMap<Edge, EdgeTag> edges = new LinkedHashMap<>();
        private Integer finalNodeId;
        private DecisionPath tracedPath;
        private DualResolution resolution;

        private Builder(TreeModel tree) {
            for (Integer id : tree.nodeIds()) {
                nodes.put(id, Identity.NONE);
            }
            for (Edge edge : tree.edges()) {
                edges.put(edge, EdgeTag.NONE);
            }
        }

        Builder node(int id, Identity identity) {
            nodes.put(id, identity);
            return this;
        }

        Builder edge(Edge edge, Identity identity, Outcome outcome) {
            edges.put(edge, new EdgeTag(identity, outcome));
            return this;
        }

        Builder finalNode(int id) {
            this.finalNodeId = id;
            return this;
        }

        Builder tracedPath(DecisionPath path) {
            this.tracedPath = path;
            return this;
        }

        Builder resolution(DualResolution resolution) {
            this.resolution = resolution;
            return this;
        }

        HighlightMap build() {
            return new HighlightMap(new LinkedHashMap<>(nodes), new LinkedHashMap<>(edges), finalNodeId,
                    tracedPath, resolution);
        }
    }
}
