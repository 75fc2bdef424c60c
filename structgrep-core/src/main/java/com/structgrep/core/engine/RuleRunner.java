package com.structgrep.core.engine;

import com.structgrep.core.formula.FormulaEvaluator;
import com.structgrep.core.location.RangeResolver;
import com.structgrep.core.match.Deadline;
import com.structgrep.core.match.Match;
import com.structgrep.core.match.MatchingOptions;
import com.structgrep.core.match.StructuralMatcher;
import com.structgrep.core.model.Finding;
import com.structgrep.core.pattern.PatternTree;
import com.structgrep.core.rule.Rule;
import com.structgrep.core.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates one rule against one parsed file.
 *
 * <p>Matches of each pattern are computed once per file and equivalence options and kept in a
 * per-file memo, so patterns repeated across rules, or inside one rule, are searched once. A
 * search that times out leaves nothing in the memo.
 *
 * <p><b>Thread Safety:</b></p>
 * <p>Instances are confined to the worker thread scanning the file.
 */
final class RuleRunner {

    private static final Logger log = LoggerFactory.getLogger(RuleRunner.class);

    private final SyntaxTree tree;
    private final RangeResolver resolver;
    private final Map<MemoKey, List<Match>> memo = new LinkedHashMap<>();

    RuleRunner(SyntaxTree tree) {
        this.tree = tree;
        this.resolver = new RangeResolver(tree);
    }

    private record MemoKey(String language, String source, MatchingOptions options) {
    }

    /**
     * Runs a rule under a time budget.
     *
     * @param rule rule whose language matches the tree
     * @param deadline budget for this (rule, file) pair
     * @return findings in range order
     * @throws com.structgrep.core.match.MatchTimeoutException if the budget runs out
     * @throws com.structgrep.core.tree.InvariantViolationException on malformed trees
     */
    List<Finding> run(Rule rule, Deadline deadline) {
        StructuralMatcher matcher = new StructuralMatcher(rule.options(), deadline);
        Map<String, List<Match>> matchesByPattern = new LinkedHashMap<>();
        rule.patterns().forEach((id, pattern) -> matchesByPattern.put(id, matches(matcher, rule.options(), pattern)));

        List<Match> matches = new FormulaEvaluator(matcher.equality()).evaluate(rule.formula(), matchesByPattern, tree);
        log.debug("Rule {} matched {} times in {}", rule.id(), matches.size(), tree.path());
        return matches.stream()
            .map(match -> new Finding(
                rule.id(),
                tree.path(),
                resolver.resolve(match.span()),
                rule.message(),
                rule.severity(),
                resolver.captures(match.environment())))
            .distinct()
            .toList();
    }

    private List<Match> matches(StructuralMatcher matcher, MatchingOptions options, PatternTree pattern) {
        MemoKey key = new MemoKey(pattern.language(), pattern.source(), options);
        List<Match> cached = memo.get(key);
        if (cached != null) {
            return cached;
        }
        List<Match> found = matcher.search(pattern, tree).toList();
        memo.put(key, found);
        return found;
    }
}
