package com.structgrep.core.pattern;

import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled pattern: a generic tree whose metavariables and ellipses have been turned into
 * marker nodes.
 *
 * <p>Immutable; one instance is shared by every file and worker that uses the rule.
 *
 * @param language language whose grammar parsed the pattern
 * @param source pattern text as written in the rule
 * @param root root of the pattern tree
 * @param metavariables names of all metavariables the pattern binds, in order of first occurrence
 */
public record PatternTree(String language, String source, Node root, Set<String> metavariables) {

    public PatternTree {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(root, "root must not be null");
        metavariables = metavariables != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(metavariables))
            : Set.of();
    }

    /**
     * Returns true for multi-statement patterns, which match runs of statements inside blocks
     * rather than a single node.
     */
    public boolean isStatementSequence() {
        return root.is(NodeKind.STATEMENTS);
    }

    @Override
    public String toString() {
        return "PatternTree[" + language + ": " + source.strip() + "]";
    }
}
