package com.structgrep.core.tree;

/**
 * Checks target trees against the {@link NodeKind} shape contract.
 *
 * <p>Front ends run this on what they produce; the matcher performs the same child check lazily
 * on the nodes it actually visits.
 */
public final class TreeValidator {

    private TreeValidator() {
        // Utility class
    }

    /**
     * Validates every node of a target tree.
     *
     * @param tree tree to validate
     * @throws InvariantViolationException on the first malformed node
     */
    public static void validateTarget(SyntaxTree tree) {
        for (Node node : tree.index().preorder()) {
            if (node.isMarker()) {
                throw new InvariantViolationException(
                    "Pattern marker " + node.kind() + " found in target " + tree.path());
            }
            checkChildren(node);
        }
    }

    /**
     * Verifies that the children of a target node have categories its kind accepts.
     *
     * @param node target node
     * @throws InvariantViolationException if a child is out of contract
     */
    public static void checkChildren(Node node) {
        NodeKind kind = node.kind();
        if (kind.isLeaf() && node.childCount() > 0) {
            throw new InvariantViolationException("Leaf kind " + kind + " has " + node.childCount() + " children");
        }
        for (Node child : node.children()) {
            if (child.isMarker()) {
                throw new InvariantViolationException("Pattern marker " + child.kind() + " inside target " + kind);
            }
            if (!kind.accepts(child.category())) {
                throw new InvariantViolationException(
                    "Kind " + kind + " cannot own a " + child.category() + " child (" + child.kind() + ")");
            }
        }
    }
}
