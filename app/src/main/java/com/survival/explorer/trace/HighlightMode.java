package com.survival.explorer.trace;

import java.util.Locale;

/**
 * How much of a traced path is revealed: the whole path, only the first
 * split, or the first {@code n} levels below the root.
 */
public record HighlightMode(Kind kind, int depth) {

    public enum Kind {
        FULL, FIRST_SPLIT, DEPTH
    }

    public static final HighlightMode FULL = new HighlightMode(Kind.FULL, -1);
    public static final HighlightMode FIRST_SPLIT = new HighlightMode(Kind.FIRST_SPLIT, 1);

    public HighlightMode {
        if (kind == null) {
            throw new IllegalArgumentException("Highlight mode kind is required");
        }
        if (kind == Kind.DEPTH && depth < 0) {
            throw new IllegalArgumentException("Depth must be >= 0 but was " + depth);
        }
        if (kind == Kind.FULL) {
            depth = -1;
        } else if (kind == Kind.FIRST_SPLIT) {
            depth = 1;
        }
    }

    public static HighlightMode depth(int n) {
        return new HighlightMode(Kind.DEPTH, n);
    }

    /**
     * Parse "full", "full_path", "first_split" or a non-negative depth.
     * Null or blank input means full.
     */
    public static HighlightMode parse(String text) {
        if (text == null || text.isBlank()) {
            return FULL;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "full", "full_path" -> FULL;
            case "first_split" -> FIRST_SPLIT;
            default -> {
                try {
                    yield depth(Integer.parseInt(normalized));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Unknown highlight mode '" + text + "'", e);
                }
            }
        };
    }

    /**
     * Partial reveals are tutorial steps; only a full path is "active".
     */
    public boolean isTutorial() {
        return kind != Kind.FULL;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FULL -> "full";
            case FIRST_SPLIT -> "first_split";
            case DEPTH -> String.valueOf(depth);
        };
    }
}
