package com.structgrep.core.formula;

import com.structgrep.core.pattern.PatternCompiler;
import com.structgrep.core.pattern.PatternTree;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FormulaValidator}.
 */
class FormulaValidatorTest {

    private final PatternCompiler compiler = new PatternCompiler();

    private Map<String, PatternTree> patterns() {
        return Map.of(
            "call", compiler.compile("java", "$X.$M($A)"),
            "method", compiler.compile("java", "void $NAME() { ... }"));
    }

    @Test
    void validate_positiveFormula_returnsBoundMetavariables() {
        Formula formula = Formula.and(
            Formula.pattern("call"),
            new Formula.Inside(Formula.pattern("method")),
            new Formula.FocusMetavariable("$NAME"));

        assertThat(FormulaValidator.validate(formula, patterns()))
            .containsExactlyInAnyOrder("$X", "$M", "$A", "$NAME");
    }

    @Test
    void validate_filterAtRoot_isRejected() {
        assertThatThrownBy(() -> FormulaValidator.validate(new Formula.Inside(Formula.pattern("call")), patterns()))
            .isInstanceOf(InvalidFormulaException.class)
            .hasMessageContaining("Inside");
    }

    @Test
    void validate_andWithoutPositiveConjunct_isRejected() {
        Formula formula = Formula.and(new Formula.Not(Formula.pattern("call")));

        assertThatThrownBy(() -> FormulaValidator.validate(formula, patterns()))
            .isInstanceOf(InvalidFormulaException.class)
            .hasMessageContaining("positive");
    }

    @Test
    void validate_emptyOr_isRejected() {
        assertThatThrownBy(() -> FormulaValidator.validate(Formula.or(), patterns()))
            .isInstanceOf(InvalidFormulaException.class);
    }

    @Test
    void validate_unknownPatternId_isRejected() {
        assertThatThrownBy(() -> FormulaValidator.validate(Formula.pattern("missing"), patterns()))
            .isInstanceOf(InvalidFormulaException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void validate_regexOnUnboundMetavariable_isRejected() {
        Formula formula = Formula.and(Formula.pattern("call"), new Formula.MetavariableRegex("$Z", ".*"));

        assertThatThrownBy(() -> FormulaValidator.validate(formula, patterns()))
            .isInstanceOf(InvalidFormulaException.class)
            .hasMessageContaining("$Z");
    }

    @Test
    void validate_malformedRegex_isRejected() {
        Formula formula = Formula.and(Formula.pattern("call"), new Formula.MetavariableRegex("$M", "get("));

        assertThatThrownBy(() -> FormulaValidator.validate(formula, patterns()))
            .isInstanceOf(InvalidFormulaException.class)
            .hasMessageContaining("Invalid regex");
    }

    @Test
    void validate_metavariableBoundOnlyByNegation_isRejected() {
        Formula formula = Formula.and(
            Formula.pattern("call"),
            new Formula.Not(Formula.pattern("method")),
            new Formula.FocusMetavariable("$NAME"));

        assertThatThrownBy(() -> FormulaValidator.validate(formula, patterns()))
            .isInstanceOf(InvalidFormulaException.class);
    }
}
