package com.structgrep.core.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeValidatorTest {

    @Test
    void validateTarget_withWellFormedTree_passes() {
        Node x = Node.leaf(NodeKind.IDENTIFIER, "x", new Span(7, 8));
        Node ret = Node.of(NodeKind.RETURN, new Span(0, 9), List.of(x));
        SyntaxTree tree = new SyntaxTree("java", "A.java", "return x;", ret);

        assertThatCode(() -> TreeValidator.validateTarget(tree)).doesNotThrowAnyException();
    }

    @Test
    void validateTarget_withMarkerInTarget_throwsInvariantViolation() {
        Node marker = Node.marker(NodeKind.METAVARIABLE, Category.EXPRESSION, "$X", new Span(7, 8), List.of());
        Node ret = Node.of(NodeKind.RETURN, new Span(0, 9), List.of(marker));
        SyntaxTree tree = new SyntaxTree("java", "A.java", "return x;", ret);

        assertThatThrownBy(() -> TreeValidator.validateTarget(tree))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("METAVARIABLE");
    }

    @Test
    void checkChildren_withChildOfWrongCategory_throwsInvariantViolation() {
        Node statement = Node.leaf(NodeKind.BREAK, "", new Span(0, 6));
        Node binary = Node.of(NodeKind.BINARY, "+", new Span(0, 6), List.of(statement, statement));

        assertThatThrownBy(() -> TreeValidator.checkChildren(binary))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("BINARY");
    }

    @Test
    void checkChildren_withLeafHavingChildren_throwsInvariantViolation() {
        Node child = Node.leaf(NodeKind.IDENTIFIER, "a", new Span(0, 1));
        Node leaf = Node.of(NodeKind.IDENTIFIER, "b", new Span(0, 1), List.of(child));

        assertThatThrownBy(() -> TreeValidator.checkChildren(leaf))
            .isInstanceOf(InvariantViolationException.class);
    }
}
