package com.structgrep.core.match;

import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import com.structgrep.core.tree.Span;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BindingEnvironment}.
 */
class BindingEnvironmentTest {

    private final StructuralEquality equality = new StructuralEquality(MatchingOptions.defaults());

    private static BoundValue identifier(String name, int offset) {
        return BoundValue.single(Node.leaf(NodeKind.IDENTIFIER, name, new Span(offset, offset + name.length())));
    }

    @Test
    void bind_newName_extendsWithoutChangingOriginal() {
        // Given
        BindingEnvironment empty = BindingEnvironment.empty();

        // When
        BindingEnvironment withX = empty.bind("$X", identifier("a", 0), equality).orElseThrow();

        // Then
        assertThat(empty.isEmpty()).isTrue();
        assertThat(withX.size()).isEqualTo(1);
        assertThat(withX.node("$X")).map(Node::value).contains("a");
    }

    @Test
    void bind_sameNameEqualValue_returnsSameEnvironment() {
        BindingEnvironment env = BindingEnvironment.empty().bind("$X", identifier("a", 0), equality).orElseThrow();

        Optional<BindingEnvironment> rebound = env.bind("$X", identifier("a", 10), equality);

        assertThat(rebound).containsSame(env);
    }

    @Test
    void bind_sameNameDifferentValue_fails() {
        BindingEnvironment env = BindingEnvironment.empty().bind("$X", identifier("a", 0), equality).orElseThrow();

        assertThat(env.bind("$X", identifier("b", 4), equality)).isEmpty();
    }

    @Test
    void bind_branchesShareParentIndependently() {
        BindingEnvironment base = BindingEnvironment.empty().bind("$X", identifier("a", 0), equality).orElseThrow();

        BindingEnvironment left = base.bind("$Y", identifier("b", 2), equality).orElseThrow();
        BindingEnvironment right = base.bind("$Y", identifier("c", 4), equality).orElseThrow();

        assertThat(left.node("$Y")).map(Node::value).contains("b");
        assertThat(right.node("$Y")).map(Node::value).contains("c");
        assertThat(base.isBound("$Y")).isFalse();
    }

    @Test
    void singleAndSequenceValues_neverEqual() {
        Node node = Node.leaf(NodeKind.IDENTIFIER, "a", new Span(0, 1));
        BindingEnvironment env = BindingEnvironment.empty().bind("$X", BoundValue.single(node), equality).orElseThrow();

        assertThat(env.bind("$X", BoundValue.sequence(List.of(node), 0), equality)).isEmpty();
    }

    @Test
    void merge_compatibleEnvironments_unionsBindings() {
        BindingEnvironment first = BindingEnvironment.empty()
            .bind("$X", identifier("a", 0), equality).orElseThrow();
        BindingEnvironment second = BindingEnvironment.empty()
            .bind("$X", identifier("a", 9), equality).orElseThrow()
            .bind("$Y", identifier("b", 12), equality).orElseThrow();

        BindingEnvironment merged = first.merge(second, equality).orElseThrow();

        assertThat(merged.asMap()).containsOnlyKeys("$X", "$Y");
        assertThat(first.isCompatibleWith(second, equality)).isTrue();
    }

    @Test
    void merge_conflictingEnvironments_fails() {
        BindingEnvironment first = BindingEnvironment.empty().bind("$X", identifier("a", 0), equality).orElseThrow();
        BindingEnvironment second = BindingEnvironment.empty().bind("$X", identifier("b", 0), equality).orElseThrow();

        assertThat(first.merge(second, equality)).isEmpty();
        assertThat(first.isCompatibleWith(second, equality)).isFalse();
    }

    @Test
    void equals_comparesBoundOccurrencesNotInsertionOrder() {
        BindingEnvironment xy = BindingEnvironment.empty()
            .bind("$X", identifier("a", 0), equality).orElseThrow()
            .bind("$Y", identifier("b", 2), equality).orElseThrow();
        BindingEnvironment yx = BindingEnvironment.empty()
            .bind("$Y", identifier("b", 2), equality).orElseThrow()
            .bind("$X", identifier("a", 0), equality).orElseThrow();
        BindingEnvironment elsewhere = BindingEnvironment.empty()
            .bind("$X", identifier("a", 20), equality).orElseThrow()
            .bind("$Y", identifier("b", 2), equality).orElseThrow();

        assertThat(xy).isEqualTo(yx).hasSameHashCodeAs(yx);
        assertThat(xy).isNotEqualTo(elsewhere);
    }
}
