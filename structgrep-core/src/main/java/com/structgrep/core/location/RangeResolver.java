package com.structgrep.core.location;

import com.structgrep.core.match.BindingEnvironment;
import com.structgrep.core.match.BoundValue;
import com.structgrep.core.model.MetavariableCapture;
import com.structgrep.core.model.SourceRange;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.Span;
import com.structgrep.core.tree.SyntaxTree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns spans, nodes and bound values of one tree into {@link SourceRange}s.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * RangeResolver resolver = new RangeResolver(tree);
 * SourceRange range = resolver.resolve(match.span());
 * Map<String, MetavariableCapture> captures = resolver.captures(match.environment());
 * }</pre>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>Immutable after construction; one instance may be shared by all rules scanning a file.
 */
public final class RangeResolver {

    private final SyntaxTree tree;
    private final LineIndex lines;

    public RangeResolver(SyntaxTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.lines = new LineIndex(tree.source());
    }

    public LineIndex lines() {
        return lines;
    }

    public SourceRange resolve(Span span) {
        Objects.requireNonNull(span, "span must not be null");
        int length = tree.source().length();
        int start = Math.min(span.start(), length);
        int end = Math.max(start, Math.min(span.end(), length));
        return new SourceRange(
            lines.line(start),
            lines.column(start),
            lines.line(end),
            lines.column(end),
            start,
            end,
            lines.byteOffset(start),
            lines.byteOffset(end)
        );
    }

    public SourceRange resolve(Node node) {
        return resolve(node.span());
    }

    /**
     * Range of a bound value. A sequence runs from its first to its last node; an empty sequence
     * collapses to a zero-width range at its anchor.
     */
    public SourceRange resolve(BoundValue value) {
        return resolve(value.span());
    }

    public MetavariableCapture capture(String name, BoundValue value) {
        return new MetavariableCapture(name, resolve(value), tree.text(value.span()));
    }

    /**
     * Captures for every binding in an environment, ordered by metavariable name.
     */
    public Map<String, MetavariableCapture> captures(BindingEnvironment environment) {
        Map<String, MetavariableCapture> captures = new LinkedHashMap<>();
        environment.asMap().forEach((name, value) -> captures.put(name, capture(name, value)));
        return captures;
    }
}
