package com.structgrep.core.match;

import java.time.Duration;
import java.util.Objects;

/**
 * Time budget for one (rule, file) match attempt.
 *
 * <p>The matcher calls {@link #check()} on every unification step. Exceeding the budget raises
 * {@link MatchTimeoutException}, which unwinds the lazy search; nothing else is affected.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, null);

    private final long expiresAtNanos;
    private final Duration budget;

    private Deadline(long expiresAtNanos, Duration budget) {
        this.expiresAtNanos = expiresAtNanos;
        this.budget = budget;
    }

    /**
     * A deadline that never expires.
     */
    public static Deadline none() {
        return NONE;
    }

    /**
     * A deadline expiring {@code budget} from now. A zero or negative budget is already expired.
     */
    public static Deadline after(Duration budget) {
        Objects.requireNonNull(budget, "budget must not be null");
        long now = System.nanoTime();
        long nanos;
        try {
            nanos = budget.toNanos();
        } catch (ArithmeticException e) {
            return NONE;
        }
        long expires;
        try {
            expires = Math.addExact(now, nanos);
        } catch (ArithmeticException e) {
            return NONE;
        }
        return new Deadline(expires, budget);
    }

    public boolean isUnlimited() {
        return this == NONE;
    }

    public boolean isExpired() {
        return !isUnlimited() && System.nanoTime() - expiresAtNanos >= 0;
    }

    /**
     * @throws MatchTimeoutException if the budget is exhausted
     */
    public void check() {
        if (isExpired()) {
            throw new MatchTimeoutException("Match exceeded time budget of " + budget.toMillis() + " ms", budget);
        }
    }

    public Duration budget() {
        return budget;
    }
}
