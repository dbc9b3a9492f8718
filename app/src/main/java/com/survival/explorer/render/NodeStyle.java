package com.survival.explorer.render;

/**
 * Visual attributes of one node.
 *
 * @param accentColor outline/glow color, or null when the node is not emphasised
 */
public record NodeStyle(
        int nodeId,
        String accentColor,
        double opacity,
        boolean glow,
        boolean finalEmphasis,
        boolean hovered) {
}
