package com.structgrep.core.formula;

import com.structgrep.core.pattern.PatternTree;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a formula before it is evaluated.
 *
 * <p>A valid formula has a positive root; every filter is a direct conjunct of an {@link
 * Formula.And} that also has at least one positive conjunct; every pattern id refers to a
 * compiled pattern; and metavariable constraints only name metavariables that the positive
 * part of their conjunction binds.
 */
public final class FormulaValidator {

    private FormulaValidator() {
        // Utility class
    }

    /**
     * Validates a formula against the patterns it may reference.
     *
     * @param formula formula to check
     * @param patterns compiled patterns by id
     * @return metavariables the formula can bind
     * @throws InvalidFormulaException describing the first problem found
     */
    public static Set<String> validate(Formula formula, Map<String, PatternTree> patterns) {
        if (!formula.isPositive()) {
            throw new InvalidFormulaException(describe(formula) + " must be a conjunct of an and-formula");
        }
        return positive(formula, patterns);
    }

    private static Set<String> positive(Formula formula, Map<String, PatternTree> patterns) {
        if (formula instanceof Formula.Pattern pattern) {
            PatternTree tree = patterns.get(pattern.id());
            if (tree == null) {
                throw new InvalidFormulaException("Unknown pattern id: " + pattern.id());
            }
            return tree.metavariables();
        }
        if (formula instanceof Formula.Or or) {
            if (or.disjuncts().isEmpty()) {
                throw new InvalidFormulaException("Or-formula has no alternatives");
            }
            Set<String> bound = new LinkedHashSet<>();
            for (Formula disjunct : or.disjuncts()) {
                bound.addAll(validate(disjunct, patterns));
            }
            return bound;
        }
        if (formula instanceof Formula.And and) {
            return conjunction(and, patterns);
        }
        throw new InvalidFormulaException(describe(formula) + " must be a conjunct of an and-formula");
    }

    private static Set<String> conjunction(Formula.And and, Map<String, PatternTree> patterns) {
        Set<String> bound = new LinkedHashSet<>();
        boolean hasPositive = false;
        for (Formula conjunct : and.conjuncts()) {
            if (conjunct.isPositive()) {
                bound.addAll(positive(conjunct, patterns));
                hasPositive = true;
            }
        }
        if (!hasPositive) {
            throw new InvalidFormulaException("And-formula needs at least one positive pattern");
        }
        for (Formula conjunct : and.conjuncts()) {
            if (conjunct instanceof Formula.Not not) {
                validate(not.formula(), patterns);
            } else if (conjunct instanceof Formula.Inside inside) {
                bound.addAll(validate(inside.formula(), patterns));
            } else if (conjunct instanceof Formula.NotInside notInside) {
                validate(notInside.formula(), patterns);
            } else if (conjunct instanceof Formula.MetavariableRegex regex) {
                requireBound(regex.metavariable(), bound);
                try {
                    java.util.regex.Pattern.compile(regex.regex());
                } catch (PatternSyntaxException e) {
                    throw new InvalidFormulaException("Invalid regex for " + regex.metavariable() + ": " + e.getDescription(), e);
                }
            } else if (conjunct instanceof Formula.MetavariablePattern nested) {
                requireBound(nested.metavariable(), bound);
                bound.addAll(validate(nested.formula(), patterns));
            } else if (conjunct instanceof Formula.FocusMetavariable focus) {
                requireBound(focus.metavariable(), bound);
            }
        }
        return bound;
    }

    private static void requireBound(String metavariable, Set<String> bound) {
        if (!bound.contains(metavariable)) {
            throw new InvalidFormulaException("Metavariable " + metavariable + " is not bound by any positive pattern");
        }
    }

    private static String describe(Formula formula) {
        return formula.getClass().getSimpleName();
    }
}
