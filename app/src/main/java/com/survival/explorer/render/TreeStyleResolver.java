package com.survival.explorer.render;

import com.survival.explorer.core.Edge;
import com.survival.explorer.core.ExplorerConfig;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.highlight.EdgeTag;
import com.survival.explorer.highlight.HighlightMap;
import com.survival.explorer.highlight.Identity;
import com.survival.explorer.highlight.Outcome;
import com.survival.explorer.hover.HighlightView;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps highlight tags to colors, opacity and stroke width.
 * Highlighted edges are always colored by their outcome, including the
 * cohort branches in a comparison.
 */
public class TreeStyleResolver {

    private final ExplorerConfig config;

    public TreeStyleResolver(ExplorerConfig config) {
        this.config = config;
    }

    public List<NodeStyle> nodeStyles(TreeModel tree, HighlightView view) {
        HighlightMap map = view.persisted();
        List<NodeStyle> styles = new ArrayList<>();
        for (Integer id : tree.nodeIds()) {
            Identity identity = map.identityOf(id);
            boolean hovered = view.isHovered(id);
            String accent = accentColor(identity);
            if (accent == null && hovered) {
                accent = config.getHoverColor();
            }
            styles.add(new NodeStyle(id, accent, opacity(identity, hovered),
                    identity != Identity.NONE, map.isFinal(id), hovered));
        }
        return styles;
    }

    public List<EdgeStyle> edgeStyles(TreeModel tree, HighlightView view) {
        HighlightMap map = view.persisted();
        int maxSamples = tree.maxSamples();
        List<EdgeStyle> styles = new ArrayList<>();
        for (Edge edge : tree.edges()) {
            EdgeTag tag = map.tagOf(edge);
            boolean hovered = view.isHovered(edge);
            String stroke = strokeColor(tag);
            if (tag.identity() == Identity.NONE && hovered) {
                stroke = config.getHoverColor();
            }
            double width = strokeWidth(tree.node(edge.targetId()).samples(), maxSamples);
            styles.add(new EdgeStyle(edge, stroke, opacity(tag.identity(), hovered), width, hovered));
        }
        return styles;
    }

    /**
     * Square-root scale of samples onto the configured width range.
     */
    public double strokeWidth(int samples, int maxSamples) {
        double min = config.getMinStrokeWidth();
        double max = config.getMaxStrokeWidth();
        if (maxSamples <= 0 || samples <= 0) {
            return min;
        }
        double ratio = Math.min(1.0, (double) samples / maxSamples);
        return min + (max - min) * Math.sqrt(ratio);
    }

    private String accentColor(Identity identity) {
        return switch (identity) {
            case NONE -> null;
            case ACTIVE -> config.getActiveColor();
            case TUTORIAL -> config.getTutorialColor();
            case PATH_A -> config.getComparisonAColor();
            case PATH_B -> config.getComparisonBColor();
            case SHARED -> config.getComparisonSharedColor();
        };
    }

    private String strokeColor(EdgeTag tag) {
        if (tag.outcome() == Outcome.SURVIVED) {
            return config.getSurvivedColor();
        }
        if (tag.outcome() == Outcome.DIED) {
            return config.getDiedColor();
        }
        String accent = accentColor(tag.identity());
        return accent == null ? config.getDefaultStrokeColor() : accent;
    }

    private double opacity(Identity identity, boolean hovered) {
        if (identity != Identity.NONE) {
            return config.getActiveOpacity();
        }
        return hovered ? config.getHoverOpacity() : config.getInactiveOpacity();
    }
}
