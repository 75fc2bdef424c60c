package com.structgrep.core.tree;

/**
 * Thrown when a generic tree breaks the shape contract of {@link NodeKind}, or when pattern-only
 * structure shows up where it cannot be.
 *
 * <p>This signals a bug upstream of the matcher (typically in a language front end). It is
 * deliberately distinct from an ordinary non-match and must never be turned into one: the
 * matcher does not catch it, and callers should report it as an internal error.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
