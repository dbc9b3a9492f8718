package com.survival.explorer.trace;

import com.survival.explorer.core.DecisionPath;

/**
 * Truncates a traced path for progressive reveal without re-tracing.
 */
public class PathLimiter {

    public DecisionPath limit(DecisionPath path, HighlightMode mode) {
        if (mode == null) {
            return path;
        }
        return switch (mode.kind()) {
            case FULL -> path;
            case FIRST_SPLIT -> path.prefix(2);
            case DEPTH -> path.prefix((int) Math.min((long) mode.depth() + 1, Integer.MAX_VALUE));
        };
    }
}
