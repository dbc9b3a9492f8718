package com.survival.explorer.core;

/**
 * A directed parent-to-child edge, identified by its endpoint ids.
 */
public record Edge(int sourceId, int targetId) {

    @Override
    public String toString() {
        return sourceId + "->" + targetId;
    }
}
