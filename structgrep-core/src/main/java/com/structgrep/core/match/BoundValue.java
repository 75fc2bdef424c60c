package com.structgrep.core.match;

import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.Span;

import java.util.List;
import java.util.Objects;

/**
 * Value bound to a metavariable: one node, or an ordered run of sibling nodes for
 * {@code $...NAME} metavariables.
 *
 * <p>Nodes are referenced, never copied; the trees they belong to are immutable.
 *
 * @param nodes bound nodes (exactly one unless {@code sequence})
 * @param sequence whether this value came from a variadic metavariable
 * @param anchor offset where an empty sequence sits in the source
 */
public record BoundValue(List<Node> nodes, boolean sequence, int anchor) {

    public BoundValue {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
        if (!sequence && nodes.size() != 1) {
            throw new IllegalArgumentException("A single binding needs exactly one node, got " + nodes.size());
        }
    }

    public static BoundValue single(Node node) {
        return new BoundValue(List.of(node), false, node.span().start());
    }

    public static BoundValue sequence(List<Node> nodes, int anchor) {
        return new BoundValue(nodes, true, anchor);
    }

    /**
     * The single bound node.
     *
     * @throws IllegalStateException for sequence values
     */
    public Node node() {
        if (sequence) {
            throw new IllegalStateException("Sequence binding has no single node");
        }
        return nodes.get(0);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Source range of the value: from the first to the last node, or a zero-width span at the
     * anchor when nothing was absorbed.
     */
    public Span span() {
        if (nodes.isEmpty()) {
            return Span.empty(anchor);
        }
        return Span.covering(nodes.get(0).span(), nodes.get(nodes.size() - 1).span());
    }
}
