package com.survival.explorer.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.survival.explorer.core.Edge;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.highlight.EdgeTag;
import com.survival.explorer.highlight.HighlightMap;
import com.survival.explorer.highlight.Identity;
import com.survival.explorer.hover.HighlightView;
import com.survival.explorer.render.EdgeStyle;
import com.survival.explorer.render.NodeStyle;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Serializes highlight tags and resolved styles to compact JSON for a renderer.
 */
public class HighlightJsonConverter {

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    /**
     * Tags of every node and edge, with the hover layer.
     */
    public String convertToViewJson(TreeModel tree, HighlightView view) {
        HighlightMap map = view.persisted();

        String nodes = tree.nodeIds().stream()
                .map(id -> {
                    Identity identity = map.identityOf(id);
                    return String.format(
                            "{\"id\":%d,\"identity\":\"%s\",\"cssClass\":\"%s\",\"final\":%b,\"hover\":%b}",
                            id, identity, identity.cssClass(), map.isFinal(id), view.isHovered(id));
                })
                .collect(Collectors.joining(",", "[", "]"));

        String edges = tree.edges().stream()
                .map(edge -> {
                    EdgeTag tag = map.tagOf(edge);
                    return String.format(
                            "{\"source\":%d,\"target\":%d,\"identity\":\"%s\",\"outcome\":\"%s\",\"hover\":%b}",
                            edge.sourceId(), edge.targetId(), tag.identity(), tag.outcome(), view.isHovered(edge));
                })
                .collect(Collectors.joining(",", "[", "]"));

        return String.format("{\"nodes\":%s,\"edges\":%s}", nodes, edges);
    }

    /**
     * Resolved visual attributes.
     */
    public String convertToStyleJson(List<NodeStyle> nodeStyles, List<EdgeStyle> edgeStyles) {
        String nodes = nodeStyles.stream()
                .map(s -> String.format(Locale.ROOT,
                        "{\"id\":%d,\"accent\":%s,\"opacity\":%.2f,\"glow\":%b,\"final\":%b}",
                        s.nodeId(), quoteOrNull(s.accentColor()), s.opacity(), s.glow(), s.finalEmphasis()))
                .collect(Collectors.joining(",", "[", "]"));

        String edges = edgeStyles.stream()
                .map(s -> {
                    Edge edge = s.edge();
                    return String.format(Locale.ROOT,
                            "{\"source\":%d,\"target\":%d,\"stroke\":%s,\"opacity\":%.2f,\"width\":%.2f}",
                            edge.sourceId(), edge.targetId(), quoteOrNull(s.strokeColor()), s.opacity(), s.width());
                })
                .collect(Collectors.joining(",", "[", "]"));

        return String.format("{\"nodes\":%s,\"edges\":%s}", nodes, edges);
    }

    /**
     * Configured colours are free text, so they go through Gson's string escaping.
     */
    private String quoteOrNull(String s) {
        return s == null ? "null" : gson.toJson(s);
    }
}
