package com.structgrep.core.formula;

import com.structgrep.core.match.Match;
import com.structgrep.core.match.MatcherTestBase;
import com.structgrep.core.match.MatchingOptions;
import com.structgrep.core.match.StructuralEquality;
import com.structgrep.core.tree.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FormulaEvaluator}.
 */
class FormulaEvaluatorTest extends MatcherTestBase {

    private final FormulaEvaluator evaluator = new FormulaEvaluator(new StructuralEquality(MatchingOptions.defaults()));

    private List<Match> evaluate(Formula formula, SyntaxTree target, String... idsAndPatterns) {
        Map<String, List<Match>> matches = new LinkedHashMap<>();
        for (int i = 0; i < idsAndPatterns.length; i += 2) {
            matches.put(idsAndPatterns[i], search(idsAndPatterns[i + 1], target));
        }
        return evaluator.evaluate(formula, matches, target);
    }

    @Test
    void evaluate_not_removesOverlappingCompatibleMatches() {
        // Given
        SyntaxTree target = parseBody("""
            a.equals(b);
            c.equals(c);
            """);

        // When
        List<Match> matches = evaluate(
            Formula.andNot(Formula.pattern("p1"), Formula.pattern("p2")), target,
            "p1", "$X.equals($Y)",
            "p2", "$X.equals($X)");

        // Then
        assertThat(texts(target, matches)).containsExactly("a.equals(b)");
    }

    @Test
    void evaluate_not_keepsMatchesWithIncompatibleBindings() {
        SyntaxTree target = parseBody("""
            a.run(b);
            a.run(a);
            """);

        List<Match> matches = evaluate(
            Formula.andNot(Formula.pattern("p1"), Formula.pattern("p2")), target,
            "p1", "$X.run($Y)",
            "p2", "$Y.run($X)");

        assertThat(texts(target, matches)).containsExactly("a.run(b)");
    }

    @Test
    void evaluate_inside_keepsMatchesWithinContextAndAddsItsBindings() {
        // Given
        SyntaxTree target = parse("""
            class T {
                Runnable r = () -> x.unlock();

                void first() {
                    lock.unlock();
                }
            }
            """);

        // When
        List<Match> matches = evaluate(
            Formula.inside(Formula.pattern("p1"), Formula.pattern("p2")), target,
            "p1", "$X.unlock()",
            "p2", "void $M() { ... }");

        // Then
        assertThat(texts(target, matches)).containsExactly("lock.unlock()");
        assertThat(bound(target, matches.get(0), "$M")).isEqualTo("first");
    }

    @Test
    void evaluate_notInside_removesMatchesWithinContext() {
        SyntaxTree target = parse("""
            class T {
                Runnable r = () -> x.unlock();

                void first() {
                    lock.unlock();
                }
            }
            """);

        List<Match> matches = evaluate(
            Formula.and(Formula.pattern("p1"), new Formula.NotInside(Formula.pattern("p2"))), target,
            "p1", "$X.unlock()",
            "p2", "void $M() { ... }");

        assertThat(texts(target, matches)).containsExactly("x.unlock()");
    }

    @Test
    void evaluate_metavariableRegex_matchesFromStartOfBoundText() {
        SyntaxTree target = parseBody("""
            a.getName();
            a.setName();
            a.get();
            """);

        List<Match> getters = evaluate(
            Formula.and(Formula.pattern("p1"), new Formula.MetavariableRegex("$M", "get")), target,
            "p1", "$O.$M()");
        List<Match> suffix = evaluate(
            Formula.and(Formula.pattern("p1"), new Formula.MetavariableRegex("$M", "Name")), target,
            "p1", "$O.$M()");

        assertThat(texts(target, getters)).containsExactly("a.getName()", "a.get()");
        assertThat(suffix).isEmpty();
    }

    @Test
    void evaluate_metavariablePattern_requiresMatchWithinBoundValue() {
        SyntaxTree target = parseBody("""
            foo(bar());
            foo(baz());
            foo(x + bar());
            """);

        List<Match> matches = evaluate(
            Formula.and(Formula.pattern("p1"), new Formula.MetavariablePattern("$A", Formula.pattern("p2"))), target,
            "p1", "foo($A)",
            "p2", "bar()");

        assertThat(texts(target, matches)).containsExactly("foo(bar())", "foo(x + bar())");
    }

    @Test
    void evaluate_focusMetavariable_narrowsRangeToBinding() {
        SyntaxTree target = parseBody("foo(first, second);");

        List<Match> matches = evaluate(
            Formula.and(Formula.pattern("p1"), new Formula.FocusMetavariable("$B")), target,
            "p1", "foo($A, $B)");

        assertThat(texts(target, matches)).containsExactly("second");
    }

    @Test
    void evaluate_andOfPatterns_keepsContainedSpanWithMergedBindings() {
        SyntaxTree target = parseBody("""
            foo(a + 1);
            foo(b);
            """);

        List<Match> matches = evaluate(
            Formula.and(Formula.pattern("p1"), Formula.pattern("p2")), target,
            "p1", "foo($X)",
            "p2", "$Y + 1");

        assertThat(texts(target, matches)).containsExactly("a + 1");
        assertThat(bound(target, matches.get(0), "$X")).isEqualTo("a + 1");
        assertThat(bound(target, matches.get(0), "$Y")).isEqualTo("a");
    }

    @Test
    void evaluate_or_returnsSortedDeduplicatedUnion() {
        SyntaxTree target = parseBody("""
            b();
            a();
            """);

        List<Match> matches = evaluate(
            Formula.or(Formula.pattern("p2"), Formula.pattern("p1"), Formula.pattern("p1")), target,
            "p1", "b()",
            "p2", "a()");

        assertThat(texts(target, matches)).containsExactly("b()", "a()");
    }

    @Test
    void evaluate_sameInputs_giveSameOutput() {
        SyntaxTree target = parseBody("""
            x.equals(y);
            y.equals(x);
            z.equals(z);
            """);
        Formula formula = Formula.andNot(Formula.pattern("p1"), Formula.pattern("p2"));

        List<Match> first = evaluate(formula, target, "p1", "$A.equals($B)", "p2", "$A.equals($A)");
        List<Match> second = evaluate(formula, target, "p1", "$A.equals($B)", "p2", "$A.equals($A)");

        assertThat(first).isEqualTo(second).hasSize(2);
    }

    @Test
    void evaluate_filterAtRoot_throwsInvalidFormula() {
        SyntaxTree target = parseBody("foo();");

        assertThatThrownBy(() -> evaluate(new Formula.Not(Formula.pattern("p1")), target, "p1", "foo()"))
            .isInstanceOf(InvalidFormulaException.class)
            .hasMessageContaining("Not");
    }

    @Test
    void evaluate_missingPatternMatches_throwsInvalidFormula() {
        SyntaxTree target = parseBody("foo();");

        assertThatThrownBy(() -> evaluate(Formula.pattern("unknown"), target, "p1", "foo()"))
            .isInstanceOf(InvalidFormulaException.class)
            .hasMessageContaining("unknown");
    }
}
