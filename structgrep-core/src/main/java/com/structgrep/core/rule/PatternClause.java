package com.structgrep.core.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of a {@code patterns} or {@code pattern-either} list. Exactly one field is set.
 *
 * @param pattern positive pattern
 * @param patterns nested conjunction
 * @param patternEither nested disjunction
 * @param patternNot pattern whose overlapping matches are removed
 * @param patternInside pattern the match must lie inside
 * @param patternNotInside pattern the match must not lie inside
 * @param metavariableRegex regex constraint on a binding
 * @param metavariablePattern nested pattern constraint on a binding
 * @param focusMetavariable metavariable whose binding becomes the reported range
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatternClause(
    @JsonProperty("pattern") String pattern,
    @JsonProperty("patterns") List<PatternClause> patterns,
    @JsonProperty("pattern-either") List<PatternClause> patternEither,
    @JsonProperty("pattern-not") String patternNot,
    @JsonProperty("pattern-inside") String patternInside,
    @JsonProperty("pattern-not-inside") String patternNotInside,
    @JsonProperty("metavariable-regex") MetavariableRegexClause metavariableRegex,
    @JsonProperty("metavariable-pattern") MetavariablePatternClause metavariablePattern,
    @JsonProperty("focus-metavariable") String focusMetavariable
) {
    public static PatternClause of(String pattern) {
        return new PatternClause(pattern, null, null, null, null, null, null, null, null);
    }

    /**
     * Number of fields set; a well-formed clause has exactly one.
     */
    public int keyCount() {
        int count = 0;
        for (Object value : new Object[] {pattern, patterns, patternEither, patternNot, patternInside,
                patternNotInside, metavariableRegex, metavariablePattern, focusMetavariable}) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * @param metavariable constrained metavariable
     * @param regex regular expression the bound text must match from its start
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetavariableRegexClause(
        @JsonProperty("metavariable") String metavariable,
        @JsonProperty("regex") String regex
    ) {}

    /**
     * @param metavariable constrained metavariable
     * @param pattern single nested pattern
     * @param patterns nested conjunction
     * @param patternEither nested disjunction
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetavariablePatternClause(
        @JsonProperty("metavariable") String metavariable,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("patterns") List<PatternClause> patterns,
        @JsonProperty("pattern-either") List<PatternClause> patternEither
    ) {}
}
