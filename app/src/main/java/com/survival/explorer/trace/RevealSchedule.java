package com.survival.explorer.trace;

import com.survival.explorer.core.DecisionPath;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered reveal steps for animating a path one level at a time.
 * The schedule is plain data; whoever plays it owns the timers.
 */
public final class RevealSchedule {

    /**
     * One frame of the reveal.
     *
     * @param mode           highlight mode to request, or null for "nothing highlighted"
     * @param durationMillis how long to hold this frame before moving on
     */
    public record RevealStep(HighlightMode mode, long durationMillis) {

        public boolean isHidden() {
            return mode == null;
        }
    }

    private RevealSchedule() {
    }

    /**
     * Hidden frame, then depth 1 .. depth of the leaf, then the full path.
     */
    public static List<RevealStep> forPath(DecisionPath path, long stepMillis) {
        if (stepMillis < 0) {
            throw new IllegalArgumentException("Step duration must be >= 0 but was " + stepMillis);
        }
        List<RevealStep> steps = new ArrayList<>();
        steps.add(new RevealStep(null, 0));
        for (int depth = 1; depth < path.size(); depth++) {
            steps.add(new RevealStep(HighlightMode.depth(depth), stepMillis));
        }
        steps.add(new RevealStep(HighlightMode.FULL, 0));
        return List.copyOf(steps);
    }
}
