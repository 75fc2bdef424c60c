package com.structgrep.core.formula;

import java.util.List;
import java.util.Objects;

/**
 * Boolean combination of patterns and filters that makes up a rule.
 *
 * <p>The set of variants is closed. {@link Pattern}, {@link And} and {@link Or} produce matches;
 * the remaining variants are filters that only have meaning as conjuncts of an {@link And}, where
 * they narrow the matches of its positive conjuncts. {@link FormulaValidator} enforces this
 * before any matching happens.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * // $X.equals($X) but not inside a test method
 * Formula formula = Formula.and(
 *     Formula.pattern("p1"),
 *     new Formula.NotInside(Formula.pattern("test-method")));
 * }</pre>
 */
public sealed interface Formula {

    /**
     * Leaf referring to a compiled pattern by id.
     */
    record Pattern(String id) implements Formula {
        public Pattern {
            Objects.requireNonNull(id, "id must not be null");
        }
    }

    /**
     * Constraint join of the positive conjuncts, narrowed by the filter conjuncts in order.
     */
    record And(List<Formula> conjuncts) implements Formula {
        public And {
            conjuncts = conjuncts != null ? List.copyOf(conjuncts) : List.of();
        }
    }

    /**
     * Union of the disjuncts' matches.
     */
    record Or(List<Formula> disjuncts) implements Formula {
        public Or {
            disjuncts = disjuncts != null ? List.copyOf(disjuncts) : List.of();
        }
    }

    /**
     * Removes matches that overlap a compatible match of {@code formula}.
     */
    record Not(Formula formula) implements Formula {
        public Not {
            Objects.requireNonNull(formula, "formula must not be null");
        }
    }

    /**
     * Keeps matches lying inside a compatible match of {@code formula}.
     */
    record Inside(Formula formula) implements Formula {
        public Inside {
            Objects.requireNonNull(formula, "formula must not be null");
        }
    }

    /**
     * Removes matches lying inside a compatible match of {@code formula}.
     */
    record NotInside(Formula formula) implements Formula {
        public NotInside {
            Objects.requireNonNull(formula, "formula must not be null");
        }
    }

    /**
     * Keeps matches whose binding of {@code metavariable} has source text matching
     * {@code regex} from its start.
     */
    record MetavariableRegex(String metavariable, String regex) implements Formula {
        public MetavariableRegex {
            Objects.requireNonNull(metavariable, "metavariable must not be null");
            Objects.requireNonNull(regex, "regex must not be null");
        }
    }

    /**
     * Keeps matches whose binding of {@code metavariable} contains a compatible match of
     * {@code formula}.
     */
    record MetavariablePattern(String metavariable, Formula formula) implements Formula {
        public MetavariablePattern {
            Objects.requireNonNull(metavariable, "metavariable must not be null");
            Objects.requireNonNull(formula, "formula must not be null");
        }
    }

    /**
     * Narrows each match's range to the value bound to {@code metavariable}.
     */
    record FocusMetavariable(String metavariable) implements Formula {
        public FocusMetavariable {
            Objects.requireNonNull(metavariable, "metavariable must not be null");
        }
    }

    /**
     * Returns true for variants that produce matches on their own.
     */
    default boolean isPositive() {
        return this instanceof Pattern || this instanceof And || this instanceof Or;
    }

    static Formula pattern(String id) {
        return new Pattern(id);
    }

    static Formula and(Formula... conjuncts) {
        return new And(List.of(conjuncts));
    }

    static Formula or(Formula... disjuncts) {
        return new Or(List.of(disjuncts));
    }

    /**
     * Matches of {@code inner} that lie within a compatible match of {@code context}.
     */
    static Formula inside(Formula inner, Formula context) {
        return new And(List.of(inner, new Inside(context)));
    }

    /**
     * Matches of {@code positive} that do not overlap a compatible match of {@code negative}.
     */
    static Formula andNot(Formula positive, Formula negative) {
        return new And(List.of(positive, new Not(negative)));
    }
}
