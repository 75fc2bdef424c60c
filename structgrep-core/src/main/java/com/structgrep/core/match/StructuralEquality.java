package com.structgrep.core.match;

import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural equality between generic subtrees.
 *
 * <p>Two nodes are equal when kinds, categories, values and children agree recursively. Spans are
 * ignored, and comments never reach the generic tree, so formatting differences do not matter.
 * {@link MatchingOptions} can additionally normalise literals or operand order. Pattern markers
 * get no special treatment here: they are compared like any other node.
 *
 * <p>Runs in time proportional to the size of the smaller subtree.
 */
public final class StructuralEquality {

    private static final Set<String> COMMUTATIVE_OPERATORS = Set.of("==", "!=", "*", "&", "|", "^", "&&", "||");

    private final MatchingOptions options;

    public StructuralEquality(MatchingOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public MatchingOptions options() {
        return options;
    }

    public boolean equal(Node left, Node right) {
        if (left == right) {
            return true;
        }
        if (left.kind() != right.kind() || left.category() != right.category()) {
            return false;
        }
        if (!valueEquals(left, right)) {
            return false;
        }
        List<Node> leftChildren = left.children();
        List<Node> rightChildren = right.children();
        if (leftChildren.size() != rightChildren.size()) {
            return false;
        }
        if (options.commutativeOperators() && isCommutative(left)) {
            return (equal(leftChildren.get(0), rightChildren.get(0)) && equal(leftChildren.get(1), rightChildren.get(1)))
                || (equal(leftChildren.get(0), rightChildren.get(1)) && equal(leftChildren.get(1), rightChildren.get(0)));
        }
        for (int i = 0; i < leftChildren.size(); i++) {
            if (!equal(leftChildren.get(i), rightChildren.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares two bound values. A single binding never equals a sequence binding.
     */
    public boolean equal(BoundValue left, BoundValue right) {
        if (left.sequence() != right.sequence() || left.nodes().size() != right.nodes().size()) {
            return false;
        }
        for (int i = 0; i < left.nodes().size(); i++) {
            if (!equal(left.nodes().get(i), right.nodes().get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares the values of two nodes of the same kind, applying literal normalisation when
     * enabled.
     */
    public boolean valueEquals(Node left, Node right) {
        NodeKind kind = left.kind();
        if (options.normalizeNumericLiterals()) {
            if (kind == NodeKind.INTEGER_LITERAL) {
                return numericEquals(parseInteger(left.value()), parseInteger(right.value()), left, right);
            }
            if (kind == NodeKind.FLOAT_LITERAL) {
                return numericEquals(parseDecimal(left.value()), parseDecimal(right.value()), left, right);
            }
        }
        if (options.normalizeStringQuotes() && (kind == NodeKind.STRING_LITERAL || kind == NodeKind.CHAR_LITERAL)) {
            return LiteralValues.decodeQuoted(left.value()).equals(LiteralValues.decodeQuoted(right.value()));
        }
        return left.value().equals(right.value());
    }

    private static boolean isCommutative(Node node) {
        return node.kind() == NodeKind.BINARY
            && node.childCount() == 2
            && COMMUTATIVE_OPERATORS.contains(node.value());
    }

    private static boolean numericEquals(Object left, Object right, Node leftNode, Node rightNode) {
        if (left == null || right == null) {
            return leftNode.value().equals(rightNode.value());
        }
        if (left instanceof BigDecimal leftDecimal && right instanceof BigDecimal rightDecimal) {
            return leftDecimal.compareTo(rightDecimal) == 0;
        }
        return left.equals(right);
    }

    private static BigInteger parseInteger(String text) {
        return LiteralValues.parseInteger(text).orElse(null);
    }

    private static BigDecimal parseDecimal(String text) {
        return LiteralValues.parseDecimal(text).orElse(null);
    }
}
