package com.survival.explorer.highlight;

import com.survival.explorer.core.FeatureVector;
import com.survival.explorer.trace.HighlightMode;

/**
 * Everything the builder needs for one recomputation.
 * Fields irrelevant to the mode are null.
 */
public record HighlightRequest(
        ViewMode mode,
        FeatureVector passenger,
        HighlightMode highlightMode,
        Cohort cohortA,
        Cohort cohortB) {

    private static final HighlightRequest IDLE = new HighlightRequest(ViewMode.IDLE, null, null, null, null);

    public HighlightRequest {
        if (mode == null) {
            throw new IllegalArgumentException("View mode is required");
        }
        if (mode == ViewMode.SINGLE && highlightMode == null) {
            highlightMode = HighlightMode.FULL;
        }
    }

    public static HighlightRequest idle() {
        return IDLE;
    }

    public static HighlightRequest single(FeatureVector passenger) {
        return new HighlightRequest(ViewMode.SINGLE, passenger, HighlightMode.FULL, null, null);
    }

    public static HighlightRequest single(FeatureVector passenger, HighlightMode highlightMode) {
        return new HighlightRequest(ViewMode.SINGLE, passenger, highlightMode, null, null);
    }

    public static HighlightRequest dual(Cohort cohortA, Cohort cohortB) {
        return new HighlightRequest(ViewMode.DUAL, null, null, cohortA, cohortB);
    }
}
