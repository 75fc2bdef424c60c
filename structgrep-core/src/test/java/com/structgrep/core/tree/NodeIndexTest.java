package com.structgrep.core.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeIndexTest {

    // foo(a, b)
    private Node callee;
    private Node argA;
    private Node argB;
    private Node arguments;
    private Node call;
    private NodeIndex index;

    @BeforeEach
    void setUp() {
        callee = Node.leaf(NodeKind.IDENTIFIER, "foo", new Span(0, 3));
        argA = Node.of(NodeKind.ARGUMENT, new Span(4, 5), List.of(Node.leaf(NodeKind.IDENTIFIER, "a", new Span(4, 5))));
        argB = Node.of(NodeKind.ARGUMENT, new Span(7, 8), List.of(Node.leaf(NodeKind.IDENTIFIER, "b", new Span(7, 8))));
        arguments = Node.of(NodeKind.ARGUMENTS, new Span(4, 8), List.of(argA, argB));
        call = Node.of(NodeKind.CALL, new Span(0, 9), List.of(callee, arguments));
        index = NodeIndex.build(call);
    }

    @Test
    void preorder_visitsParentsBeforeChildrenLeftToRight() {
        assertThat(index.preorder())
            .extracting(Node::kind)
            .containsExactly(NodeKind.CALL, NodeKind.IDENTIFIER, NodeKind.ARGUMENTS,
                NodeKind.ARGUMENT, NodeKind.IDENTIFIER, NodeKind.ARGUMENT, NodeKind.IDENTIFIER);
        assertThat(index.size()).isEqualTo(call.size()).isEqualTo(7);
    }

    @Test
    void parentOf_andAncestors_followOwnership() {
        Node b = argB.child(0);

        assertThat(index.parentOf(b)).containsSame(argB);
        assertThat(index.parentOf(call)).isEmpty();
        assertThat(index.ancestors(b)).containsExactly(argB, arguments, call);
        assertThat(index.enclosing(b, NodeKind.CALL)).containsSame(call);
        assertThat(index.enclosing(b, NodeKind.BLOCK)).isEmpty();
    }

    @Test
    void subtree_returnsNodeAndDescendants() {
        assertThat(index.subtree(arguments)).hasSize(5).first().isSameAs(arguments);
        assertThat(index.subtree(callee)).containsExactly(callee);
    }

    @Test
    void idOf_withForeignNode_throwsException() {
        Node foreign = Node.leaf(NodeKind.IDENTIFIER, "foo", new Span(0, 3));

        assertThat(index.contains(foreign)).isFalse();
        assertThatThrownBy(() -> index.idOf(foreign))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_withSharedNodeInstance_throwsInvariantViolation() {
        Node shared = Node.of(NodeKind.ARGUMENT, new Span(0, 1), List.of(Node.leaf(NodeKind.IDENTIFIER, "x", new Span(0, 1))));
        Node list = Node.of(NodeKind.ARGUMENTS, new Span(0, 1), List.of(shared, shared));

        assertThatThrownBy(() -> NodeIndex.build(list))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("more than one parent");
    }
}
