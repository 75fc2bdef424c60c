package com.structgrep.core.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structgrep.core.match.MatchingOptions;

import java.util.List;

/**
 * A rule as written in a rule file, before compilation.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * rules:
 *   - id: string-reference-equality
 *     languages: [java]
 *     severity: WARNING
 *     message: "Comparing $X with == compares references"
 *     patterns:
 *       - pattern: $X == $Y
 *       - metavariable-regex:
 *           metavariable: $X
 *           regex: "name|label"
 *       - pattern-not-inside: |
 *           if ($X == null) { ... }
 * }</pre>
 *
 * <p>Exactly one of {@code pattern}, {@code patterns} and {@code pattern-either} must be set.
 *
 * @param id rule id
 * @param languages languages the rule applies to
 * @param message finding message
 * @param severity {@code INFO}, {@code WARNING} or {@code ERROR}
 * @param pattern single pattern
 * @param patterns conjunction of clauses
 * @param patternEither disjunction of clauses
 * @param options equivalence options; engine defaults when absent
 * @param timeoutSeconds per-file budget; 0 or less means unlimited, absent means engine default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("languages") List<String> languages,
    @JsonProperty("message") String message,
    @JsonProperty("severity") String severity,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("patterns") List<PatternClause> patterns,
    @JsonProperty("pattern-either") List<PatternClause> patternEither,
    @JsonProperty("options") MatchingOptions options,
    @JsonProperty("timeout") Double timeoutSeconds
) {
    public RuleDefinition {
        languages = languages == null ? List.of() : List.copyOf(languages);
    }

    /**
     * Definition of a one-pattern rule, as used for patterns given on the command line.
     *
     * @param id rule id
     * @param language language of the pattern
     * @param pattern pattern text
     * @return definition with the pattern text as message
     */
    public static RuleDefinition ofPattern(String id, String language, String pattern) {
        return new RuleDefinition(id, List.of(language), pattern, "INFO", pattern, null, null, null, null);
    }

    /**
     * Top-level container of a rule file.
     *
     * @param rules rule definitions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleFile(@JsonProperty("rules") List<RuleDefinition> rules) {
        public RuleFile {
            rules = rules == null ? List.of() : rules;
        }
    }
}
