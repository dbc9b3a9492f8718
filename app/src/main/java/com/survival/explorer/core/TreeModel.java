package com.survival.explorer.core;

import java.util.*;

/**
 * Immutable, validated binary decision tree.
 * Construction checks every structural invariant up front, so any
 * {@code TreeModel} instance is safe to traverse without further checks.
 */
public final class TreeModel {

    private static final TreeModel EMPTY = new TreeModel(null, new LinkedHashMap<>(), Map.of(), Map.of(), List.of());

    private final TreeNode root;
    private final Map<Integer, TreeNode> nodes;
    private final Map<Integer, Integer> parents;
    private final Map<Integer, Integer> depths;
    private final List<Edge> edges;

    private TreeModel(TreeNode root, LinkedHashMap<Integer, TreeNode> nodes, Map<Integer, Integer> parents,
            Map<Integer, Integer> depths, List<Edge> edges) {
        this.root = root;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.parents = Map.copyOf(parents);
        this.depths = Map.copyOf(depths);
        this.edges = List.copyOf(edges);
    }

    /**
     * A tree with no nodes.
     */
    public static TreeModel empty() {
        return EMPTY;
    }

    /**
     * Assemble and validate a tree from its nodes.
     *
     * @throws MalformedTreeException if any structural invariant is violated
     */
    public static TreeModel of(Collection<TreeNode> nodeList) {
        if (nodeList == null || nodeList.isEmpty()) {
            return EMPTY;
        }

        Map<Integer, TreeNode> byId = new HashMap<>();
        for (TreeNode node : nodeList) {
            if (node == null) {
                throw new MalformedTreeException("Tree contains a null node");
            }
            if (byId.put(node.id(), node) != null) {
                throw new MalformedTreeException("Duplicate node id " + node.id());
            }
            checkFields(node);
        }

        Map<Integer, Integer> parents = new HashMap<>();
        for (TreeNode node : byId.values()) {
            for (Integer childId : node.children()) {
                if (!byId.containsKey(childId)) {
                    throw new MalformedTreeException(
                            "Node " + node.id() + " references missing child " + childId);
                }
                if (childId == node.id()) {
                    throw new MalformedTreeException("Node " + node.id() + " is its own child (cycle)");
                }
                Integer previous = parents.put(childId, node.id());
                if (previous != null) {
                    throw new MalformedTreeException(
                            "Node " + childId + " has more than one parent (" + previous + ", " + node.id() + ")");
                }
            }
        }

        List<TreeNode> roots = byId.values().stream()
                .filter(n -> !parents.containsKey(n.id()))
                .toList();
        if (roots.isEmpty()) {
            throw new MalformedTreeException("Tree has no root (every node has a parent, cycle)");
        }
        if (roots.size() > 1) {
            throw new MalformedTreeException("Tree has " + roots.size() + " roots, expected exactly one");
        }
        TreeNode root = roots.get(0);

        // Pre-order walk; anything not reached hangs off a detached cycle
        LinkedHashMap<Integer, TreeNode> ordered = new LinkedHashMap<>();
        Map<Integer, Integer> depths = new HashMap<>();
        List<Edge> edges = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        depths.put(root.id(), 0);
        while (!stack.isEmpty()) {
            TreeNode current = stack.pop();
            if (ordered.put(current.id(), current) != null) {
                throw new MalformedTreeException("Cycle detected at node " + current.id());
            }
            List<Integer> children = current.children();
            for (int i = 0; i < children.size(); i++) {
                edges.add(new Edge(current.id(), children.get(i)));
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                TreeNode child = byId.get(children.get(i));
                depths.put(child.id(), depths.get(current.id()) + 1);
                stack.push(child);
            }
        }
        if (ordered.size() != byId.size()) {
            Set<Integer> detached = new TreeSet<>(byId.keySet());
            detached.removeAll(ordered.keySet());
            throw new MalformedTreeException("Nodes unreachable from root " + root.id() + " (cycle): " + detached);
        }

        return new TreeModel(root, ordered, parents, depths, edges);
    }

    private static void checkFields(TreeNode node) {
        if (node.isLeaf()) {
            if (node.feature() != null || node.threshold() != null || !node.children().isEmpty()) {
                throw new MalformedTreeException("Leaf node " + node.id() + " carries split fields");
            }
            return;
        }
        if (node.feature() == null || node.feature().isBlank()) {
            throw new MalformedTreeException("Internal node " + node.id() + " has no feature");
        }
        if (node.threshold() == null || node.threshold().isNaN()) {
            throw new MalformedTreeException("Internal node " + node.id() + " has no threshold");
        }
        if (node.children().size() != 2 || node.children().contains(null)) {
            throw new MalformedTreeException("Internal node " + node.id() + " must have exactly two children");
        }
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * The root node, or null for an empty tree.
     */
    public TreeNode root() {
        return root;
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    /**
     * Look up a node by id.
     *
     * @throws NoSuchElementException if the id is not part of this tree
     */
    public TreeNode node(int id) {
        TreeNode node = nodes.get(id);
        if (node == null) {
            throw new NoSuchElementException("No node with id " + id);
        }
        return node;
    }

    public Optional<Integer> parentOf(int id) {
        return Optional.ofNullable(parents.get(id));
    }

    public int depthOf(int id) {
        Integer depth = depths.get(id);
        if (depth == null) {
            throw new NoSuchElementException("No node with id " + id);
        }
        return depth;
    }

    public int maxDepth() {
        return depths.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Node ids in pre-order (root first, left before right).
     */
    public List<Integer> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public Collection<TreeNode> nodes() {
        return nodes.values();
    }

    /**
     * Every parent-to-child edge, in pre-order of the parent.
     */
    public List<Edge> edges() {
        return edges;
    }

    public int maxSamples() {
        return nodes.values().stream().mapToInt(TreeNode::samples).max().orElse(0);
    }
}
