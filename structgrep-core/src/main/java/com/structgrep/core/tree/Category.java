package com.structgrep.core.tree;

/**
 * Syntactic category of a generic tree node.
 *
 * <p>Every {@link NodeKind} belongs to exactly one category. Categories drive the first and
 * cheapest pruning step of the matcher: a pattern node can only unify with a target node of the
 * same category, unless the pattern node is a marker ({@link #PATTERN}).
 */
public enum Category {
    EXPRESSION,
    STATEMENT,
    TYPE,
    /** Pattern-only markers: metavariables, ellipses, deep ellipses. Never present in targets. */
    PATTERN,
    PARAMETER,
    ARGUMENT,
    DECLARATION,
    ATTRIBUTE,
    LIST
}
