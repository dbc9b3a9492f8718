package com.survival.explorer.highlight;

/**
 * Survive/die coloring carried by highlighted edges.
 */
public enum Outcome {
    NONE,
    SURVIVED,
    DIED;

    /**
     * Outcome for a predicted class: 1 survived, anything else died.
     */
    public static Outcome ofClass(int predictedClass) {
        return predictedClass == 1 ? SURVIVED : DIED;
    }
}
