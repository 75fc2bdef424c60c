package com.structgrep.core.lang.java;

import com.structgrep.core.lang.FrontEndException;
import com.structgrep.core.lang.FrontEnds;
import com.structgrep.core.lang.LanguageFrontEnd;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import com.structgrep.core.tree.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link JavaFrontEnd}.
 */
class JavaFrontEndTest {

    private final JavaFrontEnd frontEnd = new JavaFrontEnd();

    private static List<Node> ofKind(SyntaxTree tree, NodeKind kind) {
        return tree.index().preorder().stream().filter(node -> node.is(kind)).toList();
    }

    @Test
    void parseTarget_validSource_lowersCompilationUnit() {
        // Given
        String source = """
            package com.example;

            import java.util.List;

            public class Service {
                private final List<String> names;

                public int count() {
                    return names.size();
                }
            }
            """;

        // When
        SyntaxTree tree = frontEnd.parseTarget("Service.java", source);

        // Then
        assertThat(tree.language()).isEqualTo("java");
        assertThat(tree.path()).isEqualTo("Service.java");
        assertThat(tree.root().kind()).isEqualTo(NodeKind.COMPILATION_UNIT);
        assertThat(ofKind(tree, NodeKind.CLASS)).hasSize(1);
        assertThat(ofKind(tree, NodeKind.METHOD)).hasSize(1);
        assertThat(ofKind(tree, NodeKind.FIELD)).hasSize(1);
        assertThat(tree.index().preorder()).noneMatch(Node::isMarker);
    }

    @Test
    void parseTarget_spansCoverSourceText() {
        String source = "class A { int f() { return compute(1, 2); } }";

        SyntaxTree tree = frontEnd.parseTarget("A.java", source);

        Node call = ofKind(tree, NodeKind.CALL).get(0);
        assertThat(tree.text(call)).isEqualTo("compute(1, 2)");
        assertThat(tree.text(ofKind(tree, NodeKind.RETURN).get(0))).isEqualTo("return compute(1, 2);");
    }

    @Test
    void parseTarget_severalDeclarators_yieldOneLocalVariableEach() {
        SyntaxTree tree = frontEnd.parseTarget("A.java", "class A { void m() { int a = 1, b = 2; } }");

        assertThat(ofKind(tree, NodeKind.LOCAL_VARIABLE)).hasSize(2);
    }

    @Test
    void parseTarget_comments_doNotReachTree() {
        SyntaxTree tree = frontEnd.parseTarget("A.java", """
            class A {
                // secret note
                void m() { /* another */ run(); }
            }
            """);

        assertThat(tree.index().preorder()).noneMatch(node -> node.value().contains("secret"));
        assertThat(tree.index().preorder()).noneMatch(node -> node.value().contains("another"));
    }

    @Test
    void parseTarget_parenthesesAreTransparent() {
        SyntaxTree tree = frontEnd.parseTarget("A.java", "class A { int x = (a + b) * c; }");

        Node multiply = ofKind(tree, NodeKind.BINARY).get(0);
        assertThat(multiply.value()).isEqualTo("*");
        assertThat(multiply.child(0).kind()).isEqualTo(NodeKind.BINARY);
        assertThat(tree.text(multiply.child(0))).isEqualTo("a + b");
    }

    @Test
    void parseTarget_syntaxError_throwsFrontEndException() {
        assertThatThrownBy(() -> frontEnd.parseTarget("Broken.java", "class Broken { void m( }"))
            .isInstanceOf(FrontEndException.class)
            .hasMessageContaining("Broken.java");
    }

    @Test
    void parsePattern_noEntryPointAccepts_throwsFrontEndException() {
        assertThatThrownBy(() -> frontEnd.parsePattern("))"))
            .isInstanceOf(FrontEndException.class)
            .hasMessageContaining("does not parse");
    }

    @Test
    void handles_javaFilesOnly() {
        assertThat(frontEnd.handles("src/Main.java")).isTrue();
        assertThat(frontEnd.handles("Main.kt")).isFalse();
        assertThat(frontEnd.handles("README")).isFalse();
    }

    @Test
    void frontEnds_discoverJavaThroughServiceLoader() {
        assertThat(FrontEnds.forLanguage("JAVA")).isPresent();
        assertThat(FrontEnds.forFile("Main.java")).isPresent();
        assertThat(FrontEnds.forLanguage("python")).isEmpty();
        assertThat(FrontEnds.all()).extracting(LanguageFrontEnd::language).contains("java");
    }
}
