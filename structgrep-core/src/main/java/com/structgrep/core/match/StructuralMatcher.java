package com.structgrep.core.match;

import com.structgrep.core.pattern.PatternTree;
import com.structgrep.core.tree.Category;
import com.structgrep.core.tree.InvariantViolationException;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import com.structgrep.core.tree.Span;
import com.structgrep.core.tree.SyntaxTree;
import com.structgrep.core.tree.TreeValidator;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Unifies pattern trees with target trees.
 *
 * <p>{@link #match(Node, Node, BindingEnvironment)} walks a pattern node and a target node in
 * lockstep and yields every environment under which they unify, as a lazy stream explored depth
 * first. {@link #search(PatternTree, SyntaxTree)} tries every target node, in pre-order, as the
 * anchor of a match.
 *
 * <p>The matcher itself holds no mutable state: environments are persistent and trees are
 * immutable, so a failed branch is discarded simply by not using its environment. One instance
 * carries the options and deadline of a single (rule, file) attempt.
 *
 * <p>A non-match is an empty stream. {@link MatchTimeoutException} and
 * {@link InvariantViolationException} escape unchanged; neither is ever caught here.
 */
public final class StructuralMatcher {

    private final StructuralEquality equality;
    private final Deadline deadline;

    public StructuralMatcher(MatchingOptions options, Deadline deadline) {
        this.equality = new StructuralEquality(Objects.requireNonNull(options, "options must not be null"));
        this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
    }

    public StructuralMatcher(MatchingOptions options) {
        this(options, Deadline.none());
    }

    public StructuralEquality equality() {
        return equality;
    }

    // ==================== Search ====================

    /**
     * Searches the whole target tree for occurrences of the pattern.
     *
     * @param pattern compiled pattern
     * @param target target tree
     * @return restartable lazy sequence of matches in pre-order of their anchors
     */
    public Matches search(PatternTree pattern, SyntaxTree target) {
        return search(pattern, target.index().preorder());
    }

    /**
     * Searches a set of candidate anchors, given in the order they should be tried.
     */
    public Matches search(PatternTree pattern, List<Node> anchors) {
        Node root = pattern.root();
        if (pattern.isStatementSequence()) {
            return Matches.of(() -> anchors.stream()
                .filter(anchor -> anchor.is(NodeKind.BLOCK) || anchor.is(NodeKind.STATEMENTS))
                .flatMap(block -> searchSequence(root.children(), block)));
        }
        return Matches.of(() -> anchors.stream()
            .filter(anchor -> canAnchor(root, anchor))
            .flatMap(anchor -> matchNode(root, anchor, BindingEnvironment.empty())
                .map(env -> new Match(anchor.span(), env))));
    }

    private Stream<Match> searchSequence(List<Node> patterns, Node block) {
        List<Node> statements = block.children();
        boolean leadingEllipsis = !patterns.isEmpty() && patterns.get(0).is(NodeKind.ELLIPSIS);
        int lastStart = leadingEllipsis ? 0 : statements.size() - 1;
        return IntStream.rangeClosed(0, lastStart).boxed()
            .flatMap(start -> sequence(patterns, 0, statements, start, BindingEnvironment.empty(), block, true)
                .filter(partial -> partial.end() > start)
                .map(partial -> new Match(
                    Span.covering(statements.get(start).span(), statements.get(partial.end() - 1).span()),
                    partial.environment())));
    }

    /**
     * Cheap pre-filter: could the pattern root possibly match at this anchor?
     */
    private static boolean canAnchor(Node root, Node anchor) {
        if (anchor.isMarker()) {
            throw new InvariantViolationException("Pattern marker " + anchor.kind() + " found in target tree");
        }
        return switch (root.kind()) {
            case ELLIPSIS, DEEP_ELLIPSIS -> true;
            case METAVARIABLE -> slotAccepts(root.category(), anchor);
            case STRING_ELLIPSIS -> anchor.is(NodeKind.STRING_LITERAL);
            default -> isStatementMetavariable(root)
                ? anchor.category() == Category.STATEMENT
                : root.kind() == anchor.kind();
        };
    }

    // ==================== Unification ====================

    /**
     * Unifies a pattern node with a target node under an initial environment.
     *
     * @param pattern pattern node
     * @param target target node
     * @param env bindings accumulated so far
     * @return lazy stream of successor environments; empty when the nodes do not unify
     */
    public Stream<BindingEnvironment> match(Node pattern, Node target, BindingEnvironment env) {
        return matchNode(pattern, target, env);
    }

    private Stream<BindingEnvironment> matchNode(Node pattern, Node target, BindingEnvironment env) {
        deadline.check();
        if (target.isMarker()) {
            throw new InvariantViolationException("Pattern marker " + target.kind() + " found in target tree");
        }
        switch (pattern.kind()) {
            case METAVARIABLE -> {
                return bindMetavariable(pattern, target, env);
            }
            case ELLIPSIS -> {
                return Stream.of(env);
            }
            case STRING_ELLIPSIS -> {
                return target.is(NodeKind.STRING_LITERAL) ? Stream.of(env) : Stream.empty();
            }
            case DEEP_ELLIPSIS -> {
                return matchDeep(pattern.child(0), target, env);
            }
            case VARIADIC_METAVARIABLE -> throw new InvariantViolationException(
                "Variadic metavariable " + pattern.value() + " outside of a sequence");
            default -> {
                // ordinary node, handled below
            }
        }

        if (isStatementMetavariable(pattern)) {
            if (target.category() != Category.STATEMENT) {
                return Stream.empty();
            }
            return env.bind(pattern.child(0).value(), BoundValue.single(target), equality).stream();
        }

        // Category and kind pruning keeps the search tractable.
        if (pattern.category() != target.category() || pattern.kind() != target.kind()) {
            return Stream.empty();
        }
        if (!equality.valueEquals(pattern, target)) {
            return Stream.empty();
        }
        TreeValidator.checkChildren(target);

        return switch (pattern.kind().shape()) {
            case LEAF -> Stream.of(env);
            case FIXED -> pattern.childCount() == target.childCount()
                ? fixed(pattern.children(), target.children(), 0, env)
                : Stream.empty();
            case SEQUENCE -> lenientEmpty(pattern)
                ? Stream.of(env)
                : sequence(pattern.children(), 0, target.children(), 0, env, target, false)
                    .map(SequenceMatch::environment);
            case UNORDERED -> lenientEmpty(pattern)
                ? Stream.of(env)
                : unordered(pattern.children(), target.children(), env);
        };
    }

    private Stream<BindingEnvironment> bindMetavariable(Node pattern, Node target, BindingEnvironment env) {
        if (!slotAccepts(pattern.category(), target)) {
            return Stream.empty();
        }
        return env.bind(pattern.value(), BoundValue.single(target), equality).stream();
    }

    private Stream<BindingEnvironment> matchDeep(Node inner, Node target, BindingEnvironment env) {
        return preorder(target).flatMap(candidate -> matchNode(inner, candidate, env));
    }

    private static Stream<Node> preorder(Node node) {
        return Stream.concat(Stream.of(node), node.children().stream().flatMap(StructuralMatcher::preorder));
    }

    private Stream<BindingEnvironment> fixed(List<Node> patterns, List<Node> targets, int index, BindingEnvironment env) {
        if (index == patterns.size()) {
            return Stream.of(env);
        }
        return matchNode(patterns.get(index), targets.get(index), env)
            .flatMap(next -> fixed(patterns, targets, index + 1, next));
    }

    // ==================== Ordered sequences ====================

    /**
     * Matches pattern elements {@code [p, ..)} against target elements {@code [t, ..)}.
     *
     * <p>An ellipsis or variadic metavariable splits the remaining target list at every possible
     * boundary, shortest absorbed run first. In prefix mode the pattern may stop before the end
     * of the target list; the returned {@code end} says where it stopped.
     */
    private Stream<SequenceMatch> sequence(List<Node> patterns, int p, List<Node> targets, int t,
                                           BindingEnvironment env, Node owner, boolean prefix) {
        deadline.check();
        if (p == patterns.size()) {
            return prefix || t == targets.size() ? Stream.of(new SequenceMatch(env, t)) : Stream.empty();
        }
        Node pattern = patterns.get(p);
        int required = requiredElements(patterns, p + 1);
        int maxEnd = targets.size() - required;

        if (pattern.is(NodeKind.ELLIPSIS)) {
            if (p == patterns.size() - 1) {
                return Stream.of(new SequenceMatch(env, targets.size()));
            }
            return IntStream.rangeClosed(t, maxEnd).boxed()
                .flatMap(end -> sequence(patterns, p + 1, targets, end, env, owner, prefix));
        }

        if (pattern.is(NodeKind.VARIADIC_METAVARIABLE)) {
            if (!owner.kind().allowsVariadic()) {
                throw new InvariantViolationException(
                    "Variadic metavariable " + pattern.value() + " inside " + owner.kind());
            }
            int anchor = anchorOffset(targets, t, owner);
            return IntStream.rangeClosed(t, maxEnd).boxed()
                .flatMap(end -> env.bind(pattern.value(), BoundValue.sequence(targets.subList(t, end), anchor), equality)
                    .stream()
                    .flatMap(next -> sequence(patterns, p + 1, targets, end, next, owner, prefix)));
        }

        if (t >= targets.size()) {
            return Stream.empty();
        }
        return matchNode(pattern, targets.get(t), env)
            .flatMap(next -> sequence(patterns, p + 1, targets, t + 1, next, owner, prefix));
    }

    private static int requiredElements(List<Node> patterns, int from) {
        int required = 0;
        for (int i = from; i < patterns.size(); i++) {
            NodeKind kind = patterns.get(i).kind();
            if (kind != NodeKind.ELLIPSIS && kind != NodeKind.VARIADIC_METAVARIABLE) {
                required++;
            }
        }
        return required;
    }

    private static int anchorOffset(List<Node> targets, int index, Node owner) {
        if (index < targets.size()) {
            return targets.get(index).span().start();
        }
        if (index > 0) {
            return targets.get(index - 1).span().end();
        }
        return owner.span().start();
    }

    // ==================== Unordered sequences ====================

    /**
     * Pairs every non-ellipsis pattern element with a distinct target element. Extra target
     * elements are allowed when the pattern holds an ellipsis or the kind is lenient.
     */
    private Stream<BindingEnvironment> unordered(List<Node> patterns, List<Node> targets, BindingEnvironment env) {
        List<Node> required = patterns.stream().filter(p -> !p.is(NodeKind.ELLIPSIS)).toList();
        if (required.size() > targets.size()) {
            return Stream.empty();
        }
        return pairings(required, 0, targets, new BitSet(targets.size()), env);
    }

    private Stream<BindingEnvironment> pairings(List<Node> patterns, int p, List<Node> targets,
                                                BitSet used, BindingEnvironment env) {
        if (p == patterns.size()) {
            return Stream.of(env);
        }
        Node pattern = patterns.get(p);
        return IntStream.range(0, targets.size())
            .filter(t -> !used.get(t))
            .boxed()
            .flatMap(t -> matchNode(pattern, targets.get(t), env)
                .flatMap(next -> {
                    BitSet taken = (BitSet) used.clone();
                    taken.set(t);
                    return pairings(patterns, p + 1, targets, taken, next);
                }));
    }

    // ==================== Helpers ====================

    private static boolean lenientEmpty(Node pattern) {
        return pattern.kind().isLenientWhenEmpty() && pattern.childCount() == 0;
    }

    /**
     * {@code $S;} written as a statement stands for any statement.
     */
    private static boolean isStatementMetavariable(Node pattern) {
        return pattern.is(NodeKind.EXPRESSION_STATEMENT)
            && pattern.childCount() == 1
            && pattern.child(0).is(NodeKind.METAVARIABLE);
    }

    private static boolean slotAccepts(Category slot, Node target) {
        return target.category() == slot;
    }

    private record SequenceMatch(BindingEnvironment environment, int end) {
    }
}
