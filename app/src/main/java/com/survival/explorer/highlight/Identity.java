package com.survival.explorer.highlight;

/**
 * Which highlight state a node or edge is in.
 */
public enum Identity {
    NONE(""),
    ACTIVE("active"),
    TUTORIAL("tutorial-highlight"),
    PATH_A("path-a"),
    PATH_B("path-b"),
    SHARED("path-shared");

    private final String cssClass;

    Identity(String cssClass) {
        this.cssClass = cssClass;
    }

    /**
     * Style class a renderer attaches for this state (empty for NONE).
     */
    public String cssClass() {
        return cssClass;
    }
}
