package com.structgrep.core.model;

/**
 * Result of evaluating one rule against one file.
 */
public enum Outcome {
    /** Evaluation finished; zero or more findings. */
    COMPLETED,
    /** The time budget ran out; the pair has no findings. */
    TIMEOUT,
    /** The target could not be parsed. */
    PARSE_ERROR,
    /** An internal invariant was violated. */
    INTERNAL_ERROR
}
