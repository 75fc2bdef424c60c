package com.structgrep.core.tree;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable node of the generic syntax tree.
 *
 * <p>Both target programs and compiled patterns are expressed with this type. A node exclusively
 * owns its children; the same instance must never appear twice in one tree (the
 * {@link NodeIndex} rejects such trees).
 *
 * <p>For ordinary nodes {@code category} always equals {@code kind.category()}. For pattern
 * markers it records the category of the slot the marker occupies, so that {@code $X} written
 * where a type is expected only binds types.
 *
 * @param kind node variant
 * @param category syntactic category (slot category for markers)
 * @param value operator, name or literal text; empty when the kind carries none
 * @param children ordered children
 * @param span source range owned by this node
 */
public record Node(
    NodeKind kind,
    Category category,
    String value,
    List<Node> children,
    Span span
) {
    public Node {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(span, "span must not be null");
        value = value != null ? value : "";
        children = children != null ? List.copyOf(children) : List.of();
        if (!kind.isMarker() && category != kind.category()) {
            throw new IllegalArgumentException(
                "Category " + category + " does not belong to kind " + kind);
        }
    }

    /**
     * Creates an ordinary node.
     */
    public static Node of(NodeKind kind, String value, Span span, List<Node> children) {
        return new Node(kind, kind.category(), value, children, span);
    }

    /**
     * Creates an ordinary node with no value.
     */
    public static Node of(NodeKind kind, Span span, List<Node> children) {
        return new Node(kind, kind.category(), "", children, span);
    }

    /**
     * Creates a leaf node.
     */
    public static Node leaf(NodeKind kind, String value, Span span) {
        return new Node(kind, kind.category(), value, List.of(), span);
    }

    /**
     * Creates a pattern marker standing in for a node of {@code slot} category.
     */
    public static Node marker(NodeKind kind, Category slot, String value, Span span, List<Node> children) {
        if (!kind.isMarker()) {
            throw new IllegalArgumentException(kind + " is not a pattern marker");
        }
        return new Node(kind, slot, value, children, span);
    }

    public boolean isMarker() {
        return kind.isMarker();
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public Node child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    /**
     * Returns a copy of this node with different children, keeping kind, value and span.
     */
    public Node withChildren(List<Node> newChildren) {
        return new Node(kind, category, value, newChildren, span);
    }

    /**
     * Counts the nodes of this subtree.
     */
    public int size() {
        int total = 1;
        for (Node child : children) {
            total += child.size();
        }
        return total;
    }

    /**
     * Renders the subtree as an s-expression without spans, e.g.
     * {@code (CALL (IDENTIFIER foo) (ARGUMENTS))}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(kind);
        if (!value.isEmpty()) {
            sb.append(' ').append(value);
        }
        if (!children.isEmpty()) {
            sb.append(' ').append(children.stream().map(Node::toString).collect(Collectors.joining(" ")));
        }
        return sb.append(')').toString();
    }
}
