package com.structgrep.core.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arena-style index over an immutable tree, built once per tree.
 *
 * <p>Nodes are numbered in pre-order, so the subtree of node {@code id} occupies the contiguous id
 * range {@code [id, subtreeEnd(id))}. Parent links live here, not in the nodes, which keeps the
 * tree acyclic and freely shareable between threads.
 */
public final class NodeIndex {

    private final List<Node> preorder;
    private final Map<Node, Integer> ids;
    private final int[] parents;
    private final int[] subtreeEnds;

    private NodeIndex(List<Node> preorder, Map<Node, Integer> ids, int[] parents, int[] subtreeEnds) {
        this.preorder = preorder;
        this.ids = ids;
        this.parents = parents;
        this.subtreeEnds = subtreeEnds;
    }

    /**
     * Builds the index for the tree rooted at {@code root}.
     *
     * @param root tree root
     * @return index
     * @throws InvariantViolationException if a node instance occurs more than once
     */
    public static NodeIndex build(Node root) {
        List<Node> order = new ArrayList<>();
        Map<Node, Integer> ids = new IdentityHashMap<>();
        List<Integer> parentList = new ArrayList<>();

        Deque<Node> stack = new ArrayDeque<>();
        Deque<Integer> parentStack = new ArrayDeque<>();
        stack.push(root);
        parentStack.push(-1);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            int parent = parentStack.pop();
            if (ids.containsKey(node)) {
                throw new InvariantViolationException("Node is owned by more than one parent: " + node.kind());
            }
            int id = order.size();
            ids.put(node, id);
            order.add(node);
            parentList.add(parent);
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
                parentStack.push(id);
            }
        }

        int size = order.size();
        int[] parents = new int[size];
        int[] subtreeEnds = new int[size];
        for (int i = 0; i < size; i++) {
            parents[i] = parentList.get(i);
            subtreeEnds[i] = i + 1;
        }
        // Children always have larger ids than their parent, so a reverse sweep settles every end.
        for (int i = size - 1; i > 0; i--) {
            int parent = parents[i];
            subtreeEnds[parent] = Math.max(subtreeEnds[parent], subtreeEnds[i]);
        }
        return new NodeIndex(Collections.unmodifiableList(order), ids, parents, subtreeEnds);
    }

    public int size() {
        return preorder.size();
    }

    /**
     * All nodes in pre-order, root first.
     */
    public List<Node> preorder() {
        return preorder;
    }

    public Node node(int id) {
        return preorder.get(id);
    }

    /**
     * Returns the pre-order id of a node of this tree.
     *
     * @throws IllegalArgumentException if the node does not belong to the tree
     */
    public int idOf(Node node) {
        Integer id = ids.get(node);
        if (id == null) {
            throw new IllegalArgumentException("Node does not belong to this tree: " + node.kind());
        }
        return id;
    }

    public boolean contains(Node node) {
        return ids.containsKey(node);
    }

    public Optional<Node> parentOf(Node node) {
        int parent = parents[idOf(node)];
        return parent < 0 ? Optional.empty() : Optional.of(preorder.get(parent));
    }

    /**
     * Ancestors of a node, nearest first, excluding the node itself.
     */
    public List<Node> ancestors(Node node) {
        List<Node> chain = new ArrayList<>();
        int current = parents[idOf(node)];
        while (current >= 0) {
            chain.add(preorder.get(current));
            current = parents[current];
        }
        return chain;
    }

    /**
     * Nearest ancestor of the given kind.
     */
    public Optional<Node> enclosing(Node node, NodeKind kind) {
        int current = parents[idOf(node)];
        while (current >= 0) {
            Node candidate = preorder.get(current);
            if (candidate.kind() == kind) {
                return Optional.of(candidate);
            }
            current = parents[current];
        }
        return Optional.empty();
    }

    /**
     * The subtree rooted at {@code node} (inclusive) in pre-order.
     */
    public List<Node> subtree(Node node) {
        int id = idOf(node);
        return preorder.subList(id, subtreeEnds[id]);
    }
}
