package com.survival.explorer.highlight;

import com.survival.explorer.core.FeatureVector;

/**
 * A named profile used as one side of a comparison.
 */
public record Cohort(String label, FeatureVector values) {

    public static Cohort of(String label, FeatureVector values) {
        return new Cohort(label, values);
    }
}
