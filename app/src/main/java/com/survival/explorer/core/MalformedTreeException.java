package com.survival.explorer.core;

/**
 * Raised when a tree violates its structural invariants.
 * A tree that fails validation is never traversed.
 */
public class MalformedTreeException extends IllegalStateException {

    public MalformedTreeException(String message) {
        super(message);
    }
}
