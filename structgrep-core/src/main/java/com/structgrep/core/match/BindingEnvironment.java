package com.structgrep.core.match;

import com.structgrep.core.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Persistent, append-only mapping from metavariable name to bound value.
 *
 * <p>Each environment is a cons cell pointing at the environment it extends, so binding is O(1)
 * and never disturbs environments that other backtracking branches still hold. Lookups walk the
 * chain, which stays short (one cell per distinct metavariable in a pattern).
 *
 * <p>Two environments are equal when they bind the same names to the same source occurrences
 * (kind and span), which is the identity used to deduplicate matches.
 */
public final class BindingEnvironment {

    private static final BindingEnvironment EMPTY = new BindingEnvironment(null, null, null, 0);

    private final String name;
    private final BoundValue value;
    private final BindingEnvironment parent;
    private final int size;

    private BindingEnvironment(String name, BoundValue value, BindingEnvironment parent, int size) {
        this.name = name;
        this.value = value;
        this.parent = parent;
        this.size = size;
    }

    public static BindingEnvironment empty() {
        return EMPTY;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public Optional<BoundValue> get(String metavariable) {
        for (BindingEnvironment env = this; env.size > 0; env = env.parent) {
            if (env.name.equals(metavariable)) {
                return Optional.of(env.value);
            }
        }
        return Optional.empty();
    }

    /**
     * Convenience accessor for single-node bindings.
     */
    public Optional<Node> node(String metavariable) {
        return get(metavariable).filter(v -> !v.sequence()).map(BoundValue::node);
    }

    public boolean isBound(String metavariable) {
        return get(metavariable).isPresent();
    }

    /**
     * Extends this environment with a binding.
     *
     * <p>If the name is already bound, no new environment is created: the result is this
     * environment when the existing value is structurally equal to {@code candidate}, or empty
     * when it is not.
     *
     * @param metavariable metavariable name
     * @param candidate value to bind
     * @param equality equality used for already-bound names
     * @return extended environment, or empty on conflict
     */
    public Optional<BindingEnvironment> bind(String metavariable, BoundValue candidate, StructuralEquality equality) {
        Optional<BoundValue> existing = get(metavariable);
        if (existing.isPresent()) {
            return equality.equal(existing.get(), candidate) ? Optional.of(this) : Optional.empty();
        }
        return Optional.of(new BindingEnvironment(metavariable, candidate, this, size + 1));
    }

    /**
     * Returns true if every metavariable bound in both environments has equal values.
     */
    public boolean isCompatibleWith(BindingEnvironment other, StructuralEquality equality) {
        BindingEnvironment smaller = size <= other.size ? this : other;
        BindingEnvironment larger = smaller == this ? other : this;
        for (BindingEnvironment env = smaller; env.size > 0; env = env.parent) {
            Optional<BoundValue> mine = larger.get(env.name);
            if (mine.isPresent() && !equality.equal(mine.get(), env.value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Adds all bindings of {@code other} that this environment lacks.
     *
     * @return merged environment, or empty if the two disagree on a shared name
     */
    public Optional<BindingEnvironment> merge(BindingEnvironment other, StructuralEquality equality) {
        Optional<BindingEnvironment> result = Optional.of(this);
        List<BindingEnvironment> cells = new ArrayList<>();
        for (BindingEnvironment env = other; env.size > 0; env = env.parent) {
            cells.add(env);
        }
        Collections.reverse(cells);
        for (BindingEnvironment cell : cells) {
            result = result.flatMap(env -> env.bind(cell.name, cell.value, equality));
            if (result.isEmpty()) {
                break;
            }
        }
        return result;
    }

    /**
     * Bindings sorted by metavariable name.
     */
    public Map<String, BoundValue> asMap() {
        Map<String, BoundValue> map = new TreeMap<>();
        for (BindingEnvironment env = this; env.size > 0; env = env.parent) {
            map.putIfAbsent(env.name, env.value);
        }
        return Collections.unmodifiableMap(map);
    }

    private List<String> identityKey() {
        List<String> key = new ArrayList<>();
        asMap().forEach((metavariable, bound) -> {
            StringBuilder sb = new StringBuilder(metavariable).append('=');
            if (bound.isEmpty()) {
                sb.append('@').append(bound.anchor());
            }
            for (Node node : bound.nodes()) {
                sb.append(node.kind()).append(node.span());
            }
            key.add(sb.toString());
        });
        return key;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof BindingEnvironment env) {
            return size == env.size && identityKey().equals(env.identityKey());
        }
        return false;
    }

    @Override
    public int hashCode() {
        return identityKey().hashCode();
    }

    @Override
    public String toString() {
        return identityKey().toString();
    }
}
