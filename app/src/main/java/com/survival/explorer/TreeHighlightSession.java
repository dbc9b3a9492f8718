package com.survival.explorer;

import com.survival.explorer.core.TreeModel;
import com.survival.explorer.highlight.HighlightDiff;
import com.survival.explorer.highlight.HighlightMap;
import com.survival.explorer.highlight.HighlightRequest;
import com.survival.explorer.highlight.HighlightStateBuilder;
import com.survival.explorer.hover.HighlightView;
import com.survival.explorer.hover.HoverOverlay;

/**
 * Highlight state for one rendered tree.
 * Persisted tags are recomputed in full on every request; hover is a
 * separate transient layer applied on top of the latest persisted map.
 * Intended for a single caller such as a UI event loop.
 */
public class TreeHighlightSession {

    private final TreeModel tree;
    private final HighlightStateBuilder builder;
    private final HoverOverlay hover;

    private HighlightRequest request = HighlightRequest.idle();
    private HighlightMap current;

    public TreeHighlightSession(TreeModel tree) {
        this(tree, new HighlightStateBuilder());
    }

    public TreeHighlightSession(TreeModel tree, HighlightStateBuilder builder) {
        this.tree = tree == null ? TreeModel.empty() : tree;
        this.builder = builder;
        this.hover = new HoverOverlay(this.tree);
        this.current = HighlightMap.idle(this.tree);
    }

    /**
     * Replace the persisted state with a fresh computation.
     *
     * @return what changed relative to the previous map
     */
    public HighlightDiff update(HighlightRequest next) {
        HighlightMap previous = current;
        request = next == null ? HighlightRequest.idle() : next;
        current = builder.build(tree, request);
        return current.diff(previous);
    }

    public void hover(int nodeId) {
        hover.enter(nodeId);
    }

    public void clearHover() {
        hover.leave();
    }

    /**
     * Apply a persisted change and a hover change from the same tick.
     * Persisted state is rebuilt first so hover is layered on current tags.
     *
     * @param hoverNodeId node under the pointer, or null for none
     * @throws IllegalArgumentException if the hover id is not in the tree; the
     *                                  persisted update still applies and hover is cleared
     */
    public HighlightView apply(HighlightRequest next, Integer hoverNodeId) {
        update(next);
        // A rejected id must not leave the previous chain over the new tags
        hover.leave();
        if (hoverNodeId != null) {
            hover.enter(hoverNodeId);
        }
        return view();
    }

    public HighlightView view() {
        return hover.overlay(current);
    }

    public HighlightMap current() {
        return current;
    }

    public HighlightRequest request() {
        return request;
    }

    public TreeModel tree() {
        return tree;
    }
}
