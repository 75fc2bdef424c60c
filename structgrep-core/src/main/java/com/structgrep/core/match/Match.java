package com.structgrep.core.match;

import com.structgrep.core.tree.Span;

import java.util.Objects;

/**
 * One way a pattern matched: the covered source span and the bindings that made it match.
 *
 * @param span matched source range
 * @param environment metavariable bindings
 */
public record Match(Span span, BindingEnvironment environment) {

    public Match {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(environment, "environment must not be null");
    }

    public Match withEnvironment(BindingEnvironment newEnvironment) {
        return new Match(span, newEnvironment);
    }

    public Match withSpan(Span newSpan) {
        return new Match(newSpan, environment);
    }
}
