package com.structgrep.core.match;

import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import com.structgrep.core.tree.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StructuralEquality}.
 */
class StructuralEqualityTest {

    private static final Span AT = new Span(0, 1);
    private static final Span ELSEWHERE = new Span(40, 41);

    private static Node id(String name, Span span) {
        return Node.leaf(NodeKind.IDENTIFIER, name, span);
    }

    private static Node binary(String operator, Node left, Node right) {
        return Node.of(NodeKind.BINARY, operator, AT, List.of(left, right));
    }

    private static StructuralEquality strict() {
        return new StructuralEquality(MatchingOptions.defaults());
    }

    @Test
    void equal_ignoresSpans() {
        Node left = binary("+", id("a", AT), id("b", AT));
        Node right = binary("+", id("a", ELSEWHERE), id("b", ELSEWHERE));

        assertThat(strict().equal(left, right)).isTrue();
    }

    @Test
    void equal_differentOperator_isFalse() {
        assertThat(strict().equal(binary("+", id("a", AT), id("b", AT)), binary("-", id("a", AT), id("b", AT))))
            .isFalse();
    }

    @Test
    void equal_differentKindSameValue_isFalse() {
        Node identifier = id("x", AT);
        Node string = Node.leaf(NodeKind.STRING_LITERAL, "x", AT);

        assertThat(strict().equal(identifier, string)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "0x10, 16",
        "1_000, 1000",
        "017, 15",
        "0b101, 5",
        "10L, 10"
    })
    void equal_numericNormalization_comparesIntegerValues(String left, String right) {
        Node a = Node.leaf(NodeKind.INTEGER_LITERAL, left, AT);
        Node b = Node.leaf(NodeKind.INTEGER_LITERAL, right, AT);

        assertThat(strict().equal(a, b)).isFalse();
        assertThat(new StructuralEquality(MatchingOptions.defaults().withNumericNormalization(true)).equal(a, b))
            .isTrue();
    }

    @Test
    void equal_numericNormalization_comparesDecimalsByValue() {
        Node a = Node.leaf(NodeKind.FLOAT_LITERAL, "1.50", AT);
        Node b = Node.leaf(NodeKind.FLOAT_LITERAL, "1.5f", AT);

        assertThat(new StructuralEquality(MatchingOptions.defaults().withNumericNormalization(true)).equal(a, b))
            .isTrue();
    }

    @Test
    void equal_stringNormalization_comparesDecodedContent() {
        Node escaped = Node.leaf(NodeKind.STRING_LITERAL, "\"a\\nb\"", AT);
        Node twoLines = Node.leaf(NodeKind.STRING_LITERAL, "\"\"\"\n    a\n    b\"\"\"", AT);
        Node plain = Node.leaf(NodeKind.STRING_LITERAL, "\"ab\"", AT);
        Node textBlock = Node.leaf(NodeKind.STRING_LITERAL, "\"\"\"\n    ab\"\"\"", AT);
        StructuralEquality normalizing = new StructuralEquality(MatchingOptions.defaults().withStringNormalization(true));

        assertThat(strict().equal(plain, textBlock)).isFalse();
        assertThat(normalizing.equal(plain, textBlock)).isTrue();
        assertThat(normalizing.equal(escaped, twoLines)).isTrue();
        assertThat(normalizing.equal(escaped, plain)).isFalse();
    }

    @Test
    void equal_commutativeOperators_ignoresOperandOrder() {
        Node ab = binary("==", id("a", AT), id("b", AT));
        Node ba = binary("==", id("b", AT), id("a", AT));
        Node minus = binary("-", id("a", AT), id("b", AT));
        Node swappedMinus = binary("-", id("b", AT), id("a", AT));
        StructuralEquality commutative = new StructuralEquality(MatchingOptions.defaults().withCommutativeOperators(true));

        assertThat(strict().equal(ab, ba)).isFalse();
        assertThat(commutative.equal(ab, ba)).isTrue();
        assertThat(commutative.equal(minus, swappedMinus)).isFalse();
    }
}
