package com.structgrep.core.formula;

import com.structgrep.core.match.BindingEnvironment;
import com.structgrep.core.match.BoundValue;
import com.structgrep.core.match.Match;
import com.structgrep.core.match.StructuralEquality;
import com.structgrep.core.tree.Span;
import com.structgrep.core.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Evaluates a {@link Formula} over the matches of its patterns in one target file.
 *
 * <p>Evaluation is bottom-up and pure: every combinator maps match lists to a match list, so the
 * per-pattern matches can be computed once per file and shared. Results are deduplicated by
 * (span, environment) and sorted by span, then by environment, so the same inputs always give
 * the same output.
 *
 * <p>Two matches are <em>compatible</em> when every metavariable bound in both is bound to
 * structurally equal values.
 */
public final class FormulaEvaluator {

    private static final Comparator<Match> ORDER = Comparator.comparing(Match::span)
        .thenComparing(match -> match.environment().toString());

    private final StructuralEquality equality;

    public FormulaEvaluator(StructuralEquality equality) {
        this.equality = Objects.requireNonNull(equality, "equality must not be null");
    }

    /**
     * Evaluates a validated formula.
     *
     * @param formula formula, already accepted by {@link FormulaValidator}
     * @param matchesByPattern matches of every referenced pattern in {@code target}
     * @param target tree the matches come from
     * @return sorted, deduplicated matches
     * @throws InvalidFormulaException if the formula misuses a filter
     */
    public List<Match> evaluate(Formula formula, Map<String, List<Match>> matchesByPattern, SyntaxTree target) {
        return sorted(eval(formula, matchesByPattern, target));
    }

    private List<Match> eval(Formula formula, Map<String, List<Match>> matches, SyntaxTree target) {
        if (formula instanceof Formula.Pattern pattern) {
            List<Match> found = matches.get(pattern.id());
            if (found == null) {
                throw new InvalidFormulaException("No matches supplied for pattern id: " + pattern.id());
            }
            return found;
        }
        if (formula instanceof Formula.Or or) {
            Set<Match> union = new LinkedHashSet<>();
            for (Formula disjunct : or.disjuncts()) {
                union.addAll(eval(disjunct, matches, target));
            }
            return new ArrayList<>(union);
        }
        if (formula instanceof Formula.And and) {
            return conjunction(and, matches, target);
        }
        throw new InvalidFormulaException(formula.getClass().getSimpleName() + " must be a conjunct of an and-formula");
    }

    // ==================== And ====================

    private List<Match> conjunction(Formula.And and, Map<String, List<Match>> matches, SyntaxTree target) {
        List<Match> result = null;
        for (Formula conjunct : and.conjuncts()) {
            if (conjunct.isPositive()) {
                List<Match> next = eval(conjunct, matches, target);
                result = result == null ? next : join(result, next);
            }
        }
        if (result == null) {
            throw new InvalidFormulaException("And-formula needs at least one positive pattern");
        }
        for (Formula conjunct : and.conjuncts()) {
            if (!conjunct.isPositive()) {
                result = filter(conjunct, result, matches, target);
            }
        }
        return result;
    }

    /**
     * Keeps each match that lies within a compatible match of the other side, with the two
     * environments merged.
     */
    private List<Match> join(List<Match> left, List<Match> right) {
        Set<Match> joined = new LinkedHashSet<>();
        for (Match a : left) {
            for (Match b : right) {
                Optional<BindingEnvironment> merged = a.environment().merge(b.environment(), equality);
                if (merged.isEmpty()) {
                    continue;
                }
                if (b.span().contains(a.span())) {
                    joined.add(new Match(a.span(), merged.get()));
                } else if (a.span().contains(b.span())) {
                    joined.add(new Match(b.span(), merged.get()));
                }
            }
        }
        return new ArrayList<>(joined);
    }

    // ==================== Filters ====================

    private List<Match> filter(Formula filter, List<Match> input, Map<String, List<Match>> matches, SyntaxTree target) {
        if (filter instanceof Formula.Not not) {
            List<Match> excluded = eval(not.formula(), matches, target);
            return keep(input, m -> excluded.stream().noneMatch(q -> q.span().overlaps(m.span()) && compatible(m, q)));
        }
        if (filter instanceof Formula.NotInside notInside) {
            List<Match> contexts = eval(notInside.formula(), matches, target);
            return keep(input, m -> contexts.stream().noneMatch(c -> c.span().contains(m.span()) && compatible(m, c)));
        }
        if (filter instanceof Formula.Inside inside) {
            List<Match> contexts = eval(inside.formula(), matches, target);
            Set<Match> kept = new LinkedHashSet<>();
            for (Match m : input) {
                for (Match c : contexts) {
                    if (c.span().contains(m.span())) {
                        m.environment().merge(c.environment(), equality).ifPresent(env -> kept.add(m.withEnvironment(env)));
                    }
                }
            }
            return new ArrayList<>(kept);
        }
        if (filter instanceof Formula.MetavariableRegex regex) {
            java.util.regex.Pattern compiled = java.util.regex.Pattern.compile(regex.regex());
            return keep(input, m -> m.environment().get(regex.metavariable())
                .map(value -> compiled.matcher(target.text(value.span())).lookingAt())
                .orElse(false));
        }
        if (filter instanceof Formula.MetavariablePattern nested) {
            return metavariablePattern(nested, input, matches, target);
        }
        if (filter instanceof Formula.FocusMetavariable focus) {
            Set<Match> focused = new LinkedHashSet<>();
            for (Match m : input) {
                m.environment().get(focus.metavariable()).ifPresent(value -> focused.add(m.withSpan(value.span())));
            }
            return new ArrayList<>(focused);
        }
        throw new InvalidFormulaException("Unexpected conjunct: " + filter.getClass().getSimpleName());
    }

    /**
     * Evaluates the nested formula over the pattern matches that fall inside the bound value, and
     * keeps the outer match for every compatible inner match.
     */
    private List<Match> metavariablePattern(Formula.MetavariablePattern nested, List<Match> input,
                                            Map<String, List<Match>> matches, SyntaxTree target) {
        Set<Match> kept = new LinkedHashSet<>();
        for (Match m : input) {
            Optional<BoundValue> bound = m.environment().get(nested.metavariable());
            if (bound.isEmpty()) {
                continue;
            }
            Span region = bound.get().span();
            Map<String, List<Match>> restricted = matches.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().stream()
                    .filter(inner -> region.contains(inner.span()))
                    .toList()));
            for (Match inner : eval(nested.formula(), restricted, target)) {
                m.environment().merge(inner.environment(), equality).ifPresent(env -> kept.add(m.withEnvironment(env)));
            }
        }
        return new ArrayList<>(kept);
    }

    private boolean compatible(Match a, Match b) {
        return a.environment().isCompatibleWith(b.environment(), equality);
    }

    private static List<Match> keep(List<Match> input, Predicate<Match> predicate) {
        return input.stream().filter(predicate).toList();
    }

    private static List<Match> sorted(List<Match> matches) {
        return matches.stream().distinct().sorted(ORDER).toList();
    }
}
