package com.structgrep.core.tree;

import java.util.Objects;

/**
 * A target file lowered into the generic tree, together with its source text.
 *
 * <p>Immutable and safe to share between worker threads. The {@link NodeIndex} is built eagerly
 * so concurrent readers never race on it.
 */
public final class SyntaxTree {

    private final String language;
    private final String path;
    private final String source;
    private final Node root;
    private final NodeIndex index;

    public SyntaxTree(String language, String path, String source, Node root) {
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.path = path != null ? path : "<memory>";
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.index = NodeIndex.build(root);
    }

    public String language() {
        return language;
    }

    /**
     * Path of the file the tree was parsed from, or {@code <memory>}.
     */
    public String path() {
        return path;
    }

    public String source() {
        return source;
    }

    public Node root() {
        return root;
    }

    public NodeIndex index() {
        return index;
    }

    /**
     * Source text covered by a span, clamped to the source bounds.
     */
    public String text(Span span) {
        int start = Math.min(span.start(), source.length());
        int end = Math.min(span.end(), source.length());
        return source.substring(start, end);
    }

    public String text(Node node) {
        return text(node.span());
    }

    @Override
    public String toString() {
        return "SyntaxTree[" + language + ", " + path + ", " + index.size() + " nodes]";
    }
}
