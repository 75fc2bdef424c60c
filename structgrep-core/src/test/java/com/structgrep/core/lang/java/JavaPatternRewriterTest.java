package com.structgrep.core.lang.java;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JavaPatternRewriter}.
 */
class JavaPatternRewriterTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "foo(...)                 | foo($__ELLIPSIS__)",
        "foo($X, ...)             | foo($X, $__ELLIPSIS__)",
        "log($...ARGS)            | log($__VARIADIC__ARGS)",
        "foo(<... $X ...>)        | foo($__DEEP__( $X ))",
        "void m(String... args)   | void m(String... args)"
    })
    void rewrite_expressionContexts(String pattern, String expected) {
        assertThat(JavaPatternRewriter.rewrite(pattern)).isEqualTo(expected);
    }

    @Test
    void rewrite_ellipsisInDeclarationHeader_becomesParameter() {
        assertThat(JavaPatternRewriter.rewrite("void $M(...) { }"))
            .isEqualTo("void $M(Object $__ELLIPSIS__) { }");
    }

    @Test
    void rewrite_ellipsisWhereStatementStarts_becomesStatement() {
        assertThat(JavaPatternRewriter.rewrite("void $M() { ... }"))
            .isEqualTo("void $M() { $__ELLIPSIS__; }");
        assertThat(JavaPatternRewriter.rewrite("a();\n...\nb();"))
            .isEqualTo("a();\n$__ELLIPSIS__;\nb();");
    }

    @Test
    void rewrite_ellipsisInClassBody_becomesField() {
        assertThat(JavaPatternRewriter.rewrite("class $C { ... }"))
            .isEqualTo("class $C { Object $__ELLIPSIS__; }");
    }

    @Test
    void rewrite_quotedTextAndComments_areCopiedVerbatim() {
        assertThat(JavaPatternRewriter.rewrite("log(\"...\") // ..."))
            .isEqualTo("log(\"...\") // ...");
    }

    @Test
    void rewrite_ellipsisInCatchClause_becomesParameter() {
        assertThat(JavaPatternRewriter.rewrite("try { ... } catch (...) { ... }"))
            .isEqualTo("try { $__ELLIPSIS__; } catch (Object $__ELLIPSIS__) { $__ELLIPSIS__; }");
    }
}
