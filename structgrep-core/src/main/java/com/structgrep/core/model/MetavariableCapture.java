package com.structgrep.core.model;

import java.util.Objects;

/**
 * The value a metavariable was bound to in a finding.
 *
 * @param name metavariable name, e.g. {@code $X} or {@code $...ARGS}
 * @param range location of the bound code (zero-width for an empty sequence)
 * @param text exact source text of the bound code
 */
public record MetavariableCapture(String name, SourceRange range, String text) {

    public MetavariableCapture {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(range, "range must not be null");
        if (text == null) {
            text = "";
        }
    }
}
