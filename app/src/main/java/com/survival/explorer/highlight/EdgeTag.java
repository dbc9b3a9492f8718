package com.survival.explorer.highlight;

/**
 * Identity and outcome tags of one edge.
 */
public record EdgeTag(Identity identity, Outcome outcome) {

    public static final EdgeTag NONE = new EdgeTag(Identity.NONE, Outcome.NONE);

    public EdgeTag {
        if (identity == null || outcome == null) {
            throw new IllegalArgumentException("Edge tags must not be null");
        }
    }
}
