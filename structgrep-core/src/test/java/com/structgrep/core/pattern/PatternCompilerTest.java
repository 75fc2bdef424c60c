package com.structgrep.core.pattern;

import com.structgrep.core.tree.Category;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PatternCompiler}.
 */
class PatternCompilerTest {

    private final PatternCompiler compiler = new PatternCompiler();

    private static List<Node> preorder(Node root) {
        List<Node> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(Node node, List<Node> into) {
        into.add(node);
        node.children().forEach(child -> collect(child, into));
    }

    private static List<Node> markers(PatternTree pattern, NodeKind kind) {
        return preorder(pattern.root()).stream().filter(node -> node.is(kind)).toList();
    }

    @Test
    void compile_expressionPattern_recordsMetavariablesInOrder() {
        // When
        PatternTree pattern = compiler.compile("java", "$X.equals($Y) && $X != null");

        // Then
        assertThat(pattern.metavariables()).containsExactly("$X", "$Y");
        assertThat(pattern.root().kind()).isEqualTo(NodeKind.BINARY);
        assertThat(pattern.isStatementSequence()).isFalse();
    }

    @Test
    void compile_metavariableInTypePosition_takesTypeCategory() {
        PatternTree pattern = compiler.compile("java", "($T) $E");

        List<Node> metavariables = markers(pattern, NodeKind.METAVARIABLE);

        assertThat(metavariables).extracting(Node::value).containsExactly("$T", "$E");
        assertThat(metavariables).extracting(Node::category).containsExactly(Category.TYPE, Category.EXPRESSION);
    }

    @Test
    void compile_ellipsisForms_becomeMarkers() {
        PatternTree pattern = compiler.compile("java", "foo(..., \"...\", <... bar() ...>)");

        assertThat(markers(pattern, NodeKind.ELLIPSIS)).hasSize(1);
        assertThat(markers(pattern, NodeKind.STRING_ELLIPSIS)).hasSize(1);
        assertThat(markers(pattern, NodeKind.DEEP_ELLIPSIS)).hasSize(1);
        assertThat(markers(pattern, NodeKind.DEEP_ELLIPSIS).get(0).child(0).kind()).isEqualTo(NodeKind.CALL);
    }

    @Test
    void compile_variadicArgument_becomesVariadicMarker() {
        PatternTree pattern = compiler.compile("java", "log($FMT, $...ARGS)");

        assertThat(markers(pattern, NodeKind.VARIADIC_METAVARIABLE)).extracting(Node::value)
            .containsExactly("$...ARGS");
        assertThat(pattern.metavariables()).containsExactly("$FMT", "$...ARGS");
    }

    @Test
    void compile_manyMetavariables_keepsOrderOfFirstOccurrence() {
        PatternTree pattern = compiler.compile("java", "call($E, $D, $C, $B, $A, $E)");

        assertThat(pattern.metavariables()).containsExactly("$E", "$D", "$C", "$B", "$A");
    }

    @Test
    void compile_severalStatements_isStatementSequence() {
        PatternTree pattern = compiler.compile("java", """
            $L.lock();
            ...
            $L.unlock();
            """);

        assertThat(pattern.isStatementSequence()).isTrue();
        assertThat(pattern.root().childCount()).isEqualTo(3);
        assertThat(pattern.root().child(1).kind()).isEqualTo(NodeKind.ELLIPSIS);
    }

    @Test
    void compile_methodPattern_parsesAsDeclaration() {
        PatternTree pattern = compiler.compile("java", "public void $M(...) { ... }");

        assertThat(pattern.root().kind()).isEqualTo(NodeKind.METHOD);
        assertThat(markers(pattern, NodeKind.ELLIPSIS)).hasSize(2);
    }

    @Test
    void compile_classPattern_parsesAsCompilationUnitOrDeclaration() {
        PatternTree pattern = compiler.compile("java", "class $C extends Base { ... }");

        assertThat(preorder(pattern.root())).anyMatch(node -> node.is(NodeKind.CLASS));
    }

    @Test
    void compile_sameText_returnsCachedInstance() {
        PatternTree first = compiler.compile("java", "foo($X)");
        PatternTree second = compiler.compile("java", "foo($X)");

        assertThat(second).isSameAs(first);
        assertThat(compiler.cacheSize()).isEqualTo(1);
    }

    @Test
    void compile_variadicOutsideList_isRejected() {
        assertThatThrownBy(() -> compiler.compile("java", "$...X + 1"))
            .isInstanceOf(PatternParseException.class)
            .hasMessageContaining("$...X");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n"})
    void compile_blankPattern_isRejected(String blank) {
        assertThatThrownBy(() -> compiler.compile("java", blank))
            .isInstanceOf(PatternParseException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void compile_unparseablePattern_isRejected() {
        assertThatThrownBy(() -> compiler.compile("java", "foo(("))
            .isInstanceOf(PatternParseException.class)
            .satisfies(e -> assertThat(((PatternParseException) e).getPattern()).isEqualTo("foo(("));
    }

    @Test
    void compile_unknownLanguage_isRejected() {
        assertThatThrownBy(() -> compiler.compile("cobol", "foo()"))
            .isInstanceOf(PatternParseException.class)
            .hasMessageContaining("cobol");
    }

    @Test
    void isMetavariableName_acceptsOnlyUppercaseDollarNames() {
        assertThat(PatternCompiler.isMetavariableName("$X")).isTrue();
        assertThat(PatternCompiler.isMetavariableName("$FOO_1")).isTrue();
        assertThat(PatternCompiler.isMetavariableName("$x")).isFalse();
        assertThat(PatternCompiler.isMetavariableName("X")).isFalse();
        assertThat(PatternCompiler.isMetavariableName(PatternSentinels.ELLIPSIS)).isFalse();
    }
}
