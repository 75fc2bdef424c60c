package com.structgrep.core.model;

import java.util.Objects;

/**
 * Outcome of one (rule, file) pair.
 *
 * @param ruleId rule id
 * @param path file path
 * @param outcome how evaluation ended
 * @param findings number of findings produced
 * @param elapsedMillis wall-clock time spent on the pair
 */
public record PairOutcome(String ruleId, String path, Outcome outcome, int findings, long elapsedMillis) {

    public PairOutcome {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }
}
