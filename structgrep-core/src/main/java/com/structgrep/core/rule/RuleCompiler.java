package com.structgrep.core.rule;

import com.structgrep.core.formula.Formula;
import com.structgrep.core.formula.FormulaValidator;
import com.structgrep.core.formula.InvalidFormulaException;
import com.structgrep.core.lang.FrontEnds;
import com.structgrep.core.match.MatchingOptions;
import com.structgrep.core.model.ErrorKind;
import com.structgrep.core.model.Severity;
import com.structgrep.core.pattern.PatternCompiler;
import com.structgrep.core.pattern.PatternParseException;
import com.structgrep.core.pattern.PatternTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns {@link RuleDefinition}s into executable {@link Rule}s.
 *
 * <p>A definition yields one rule per language. Every pattern text gets an id ({@code p0},
 * {@code p1}, ...) and is compiled through the shared {@link PatternCompiler}; the resulting
 * formula is checked by {@link FormulaValidator} before the rule is accepted. A definition that
 * fails any step produces a {@link RuleError} and no rules; compilation of the remaining
 * definitions continues.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * RuleCompiler compiler = new RuleCompiler(new PatternCompiler(), MatchingOptions.defaults());
 * RuleCompiler.Result result = compiler.compileAll(RuleLoader.load(Path.of("rules.yaml")));
 * result.errors().forEach(error -> log.warn("{}: {}", error.ruleId(), error.message()));
 * }</pre>
 */
public final class RuleCompiler {

    private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

    private final PatternCompiler patternCompiler;
    private final MatchingOptions defaultOptions;

    public RuleCompiler(PatternCompiler patternCompiler, MatchingOptions defaultOptions) {
        this.patternCompiler = Objects.requireNonNull(patternCompiler, "patternCompiler must not be null");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
    }

    public RuleCompiler() {
        this(new PatternCompiler(), MatchingOptions.defaults());
    }

    /**
     * Compiled rules and the diagnostics of the definitions that were skipped.
     *
     * @param rules compiled rules, in definition order
     * @param errors one diagnostic per rejected definition
     */
    public record Result(List<Rule> rules, List<RuleError> errors) {
        public Result {
            rules = List.copyOf(rules);
            errors = List.copyOf(errors);
        }
    }

    /**
     * Compiles all definitions, collecting diagnostics instead of failing.
     *
     * @param definitions rule definitions
     * @return compiled rules and diagnostics
     */
    public Result compileAll(List<RuleDefinition> definitions) {
        List<Rule> rules = new ArrayList<>();
        List<RuleError> errors = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            RuleDefinition definition = definitions.get(i);
            String ruleId = definition.id() != null && !definition.id().isBlank() ? definition.id() : "rule-" + (i + 1);
            try {
                rules.addAll(compile(definition));
            } catch (PatternParseException e) {
                log.warn("Skipping rule {}: invalid pattern: {}", ruleId, e.getMessage());
                errors.add(new RuleError(ruleId, ErrorKind.PATTERN_PARSE_ERROR, e.getMessage()));
            } catch (InvalidRuleException | InvalidFormulaException e) {
                log.warn("Skipping rule {}: {}", ruleId, e.getMessage());
                errors.add(new RuleError(ruleId, ErrorKind.INVALID_RULE, e.getMessage()));
            }
        }
        log.debug("Compiled {} rules from {} definitions ({} rejected)", rules.size(), definitions.size(), errors.size());
        return new Result(rules, errors);
    }

    /**
     * Compiles one definition.
     *
     * @param definition rule definition
     * @return one rule per language
     * @throws PatternParseException if a pattern does not parse
     * @throws InvalidRuleException if the definition is malformed
     * @throws InvalidFormulaException if the formula is ill-formed
     */
    public List<Rule> compile(RuleDefinition definition) {
        String id = definition.id();
        if (id == null || id.isBlank()) {
            throw new InvalidRuleException("Rule has no id");
        }
        if (definition.languages().isEmpty()) {
            throw new InvalidRuleException("Rule " + id + " names no languages");
        }
        Severity severity = parseSeverity(id, definition.severity());
        Duration timeout = timeout(definition.timeoutSeconds());
        MatchingOptions options = definition.options() != null ? definition.options() : defaultOptions;

        List<Rule> rules = new ArrayList<>();
        for (String rawLanguage : definition.languages()) {
            String language = rawLanguage.toLowerCase(Locale.ROOT);
            if (FrontEnds.forLanguage(language).isEmpty()) {
                throw new InvalidRuleException("Rule " + id + " uses unsupported language: " + rawLanguage);
            }
            FormulaBuilder builder = new FormulaBuilder(id, language);
            Formula formula = builder.top(definition);
            FormulaValidator.validate(formula, builder.patterns);
            rules.add(new Rule(id, language, definition.message(), severity, formula, builder.patterns, options, timeout));
        }
        return rules;
    }

    private static Severity parseSeverity(String ruleId, String severity) {
        try {
            return Severity.parse(severity);
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("Rule " + ruleId + " has unknown severity: " + severity);
        }
    }

    private static Duration timeout(Double seconds) {
        if (seconds == null) {
            return null;
        }
        if (seconds <= 0) {
            return ChronoUnit.FOREVER.getDuration();
        }
        return Duration.ofNanos(Math.max(1L, Math.round(seconds * 1_000_000_000L)));
    }

    /**
     * Builds the formula of one (definition, language) pair and compiles its patterns.
     */
    private final class FormulaBuilder {

        private final String ruleId;
        private final String language;
        private final Map<String, PatternTree> patterns = new LinkedHashMap<>();

        FormulaBuilder(String ruleId, String language) {
            this.ruleId = ruleId;
            this.language = language;
        }

        Formula top(RuleDefinition definition) {
            int keys = (definition.pattern() != null ? 1 : 0)
                + (definition.patterns() != null ? 1 : 0)
                + (definition.patternEither() != null ? 1 : 0);
            if (keys != 1) {
                throw new InvalidRuleException("Rule " + ruleId
                    + " must have exactly one of pattern, patterns or pattern-either");
            }
            if (definition.pattern() != null) {
                return pattern(definition.pattern());
            }
            if (definition.patterns() != null) {
                return and(definition.patterns());
            }
            return or(definition.patternEither());
        }

        private Formula clause(PatternClause clause) {
            if (clause == null || clause.keyCount() != 1) {
                throw new InvalidRuleException("Rule " + ruleId + " has a pattern clause with "
                    + (clause == null ? 0 : clause.keyCount()) + " operators; expected exactly one");
            }
            if (clause.pattern() != null) {
                return pattern(clause.pattern());
            }
            if (clause.patterns() != null) {
                return and(clause.patterns());
            }
            if (clause.patternEither() != null) {
                return or(clause.patternEither());
            }
            if (clause.patternNot() != null) {
                return new Formula.Not(pattern(clause.patternNot()));
            }
            if (clause.patternInside() != null) {
                return new Formula.Inside(pattern(clause.patternInside()));
            }
            if (clause.patternNotInside() != null) {
                return new Formula.NotInside(pattern(clause.patternNotInside()));
            }
            if (clause.metavariableRegex() != null) {
                PatternClause.MetavariableRegexClause regex = clause.metavariableRegex();
                return new Formula.MetavariableRegex(
                    required(regex.metavariable(), "metavariable-regex.metavariable"),
                    required(regex.regex(), "metavariable-regex.regex"));
            }
            if (clause.metavariablePattern() != null) {
                PatternClause.MetavariablePatternClause nested = clause.metavariablePattern();
                String metavariable = required(nested.metavariable(), "metavariable-pattern.metavariable");
                return new Formula.MetavariablePattern(metavariable, nested(nested));
            }
            return new Formula.FocusMetavariable(clause.focusMetavariable());
        }

        private Formula nested(PatternClause.MetavariablePatternClause nested) {
            int keys = (nested.pattern() != null ? 1 : 0)
                + (nested.patterns() != null ? 1 : 0)
                + (nested.patternEither() != null ? 1 : 0);
            if (keys != 1) {
                throw new InvalidRuleException("Rule " + ruleId
                    + ": metavariable-pattern needs exactly one of pattern, patterns or pattern-either");
            }
            if (nested.pattern() != null) {
                return pattern(nested.pattern());
            }
            return nested.patterns() != null ? and(nested.patterns()) : or(nested.patternEither());
        }

        private Formula and(List<PatternClause> clauses) {
            return new Formula.And(clauses.stream().map(this::clause).toList());
        }

        private Formula or(List<PatternClause> clauses) {
            return new Formula.Or(clauses.stream().map(this::clause).toList());
        }

        private Formula pattern(String source) {
            String id = "p" + patterns.size();
            patterns.put(id, patternCompiler.compile(language, source));
            return new Formula.Pattern(id);
        }

        private String required(String value, String field) {
            if (value == null || value.isBlank()) {
                throw new InvalidRuleException("Rule " + ruleId + " is missing " + field);
            }
            return value;
        }
    }
}
