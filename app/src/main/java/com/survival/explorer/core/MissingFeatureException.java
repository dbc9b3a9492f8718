package com.survival.explorer.core;

/**
 * A feature tested along the path has no value in the supplied vector.
 */
public class MissingFeatureException extends RuntimeException {

    private final String feature;
    private final int nodeId;

    public MissingFeatureException(String feature, int nodeId) {
        super("No value for feature '" + feature + "' tested at node " + nodeId);
        this.feature = feature;
        this.nodeId = nodeId;
    }

    public String getFeature() {
        return feature;
    }

    public int getNodeId() {
        return nodeId;
    }
}
