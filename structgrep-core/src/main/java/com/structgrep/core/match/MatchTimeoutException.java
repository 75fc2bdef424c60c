package com.structgrep.core.match;

import java.time.Duration;

/**
 * Raised when a (rule, file) match attempt exceeds its time budget.
 *
 * <p>Recoverable: the caller records the pair as timed out and carries on with other pairs.
 */
public class MatchTimeoutException extends RuntimeException {

    private final transient Duration budget;

    public MatchTimeoutException(String message, Duration budget) {
        super(message);
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }
}
