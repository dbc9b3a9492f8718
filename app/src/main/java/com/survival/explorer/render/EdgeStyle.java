package com.survival.explorer.render;

import com.survival.explorer.core.Edge;

/**
 * Visual attributes of one edge.
 */
public record EdgeStyle(
        Edge edge,
        String strokeColor,
        double opacity,
        double width,
        boolean hovered) {
}
