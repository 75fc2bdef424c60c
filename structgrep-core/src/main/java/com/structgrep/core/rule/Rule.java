package com.structgrep.core.rule;

import com.structgrep.core.formula.Formula;
import com.structgrep.core.match.MatchingOptions;
import com.structgrep.core.model.Severity;
import com.structgrep.core.pattern.PatternTree;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled, validated rule for one language.
 *
 * @param id rule id
 * @param language language the patterns were compiled for
 * @param message finding message; may reference metavariables such as {@code $X}
 * @param severity severity of the findings
 * @param formula validated formula over {@code patterns}
 * @param patterns compiled patterns by the ids the formula uses
 * @param options equivalence options for matching
 * @param timeout per-file budget overriding the engine default, or {@code null}
 */
public record Rule(
    String id,
    String language,
    String message,
    Severity severity,
    Formula formula,
    Map<String, PatternTree> patterns,
    MatchingOptions options,
    Duration timeout
) {
    public Rule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        if (message == null) {
            message = "";
        }
        if (severity == null) {
            severity = Severity.WARNING;
        }
        patterns = patterns == null ? Map.of() : Map.copyOf(patterns);
        if (options == null) {
            options = MatchingOptions.defaults();
        }
    }

    @Override
    public String toString() {
        return "Rule[" + id + ", " + language + ", " + patterns.size() + " patterns]";
    }
}
