package com.structgrep.core.lang.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.structgrep.core.lang.FrontEndException;
import com.structgrep.core.lang.LanguageFrontEnd;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import com.structgrep.core.tree.Span;
import com.structgrep.core.tree.SyntaxTree;
import com.structgrep.core.tree.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Java front end backed by JavaParser (language level Java 17).
 *
 * <p>Targets are parsed as compilation units. Patterns are tried, in order, as an expression, as
 * the statements of a block, as a class member and finally as a compilation unit; the first
 * entry point that accepts the text wins. A block holding a single statement yields that
 * statement; several statements yield a {@link NodeKind#STATEMENTS} root.
 *
 * <p><b>Thread Safety:</b></p>
 * <p>A JavaParser instance keeps per-parse state, so every parse creates its own; the shared
 * {@link ParserConfiguration} is only read.</p>
 *
 * @see JavaTreeLowering
 * @see JavaPatternRewriter
 */
public final class JavaFrontEnd implements LanguageFrontEnd {

    private static final Logger log = LoggerFactory.getLogger(JavaFrontEnd.class);

    public static final String LANGUAGE = "java";

    private static final ParserConfiguration CONFIGURATION = new ParserConfiguration()
        .setLanguageLevel(LanguageLevel.JAVA_17)
        .setAttributeComments(false);

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of("java");
    }

    @Override
    public SyntaxTree parseTarget(String path, String source) {
        ParseResult<CompilationUnit> result = new JavaParser(CONFIGURATION).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new FrontEndException(LANGUAGE, "Failed to parse " + path + ": " + describe(result.getProblems()));
        }
        Node root = new JavaTreeLowering(source).lowerCompilationUnit(result.getResult().get());
        SyntaxTree tree = new SyntaxTree(LANGUAGE, path, source, root);
        TreeValidator.validateTarget(tree);
        log.debug("Parsed {} into {} nodes", path, tree.index().size());
        return tree;
    }

    @Override
    public Node parsePattern(String patternSource) {
        String rewritten = JavaPatternRewriter.rewrite(patternSource);
        log.debug("Rewrote pattern '{}' to '{}'", patternSource.strip(), rewritten.strip());

        List<Problem> firstProblems = new ArrayList<>();
        Optional<Node> lowered = this.<Expression>attempt(rewritten,
                (parser, text) -> parser.parseExpression(text),
                (lowering, expression) -> expression.map(lowering::lowerExpression), firstProblems)
            .or(() -> attemptBlock(rewritten, firstProblems))
            .or(() -> this.<BodyDeclaration<?>>attempt(rewritten,
                (parser, text) -> parser.parseBodyDeclaration(text),
                (lowering, member) -> member.map(m -> asRoot(lowering.lowerMember(m))), firstProblems))
            .or(() -> this.<CompilationUnit>attempt(rewritten,
                (parser, text) -> parser.parse(text),
                (lowering, unit) -> unit.map(lowering::lowerCompilationUnit), firstProblems));

        return lowered.orElseThrow(() -> new FrontEndException(LANGUAGE,
            "Pattern does not parse as Java: " + describe(firstProblems)));
    }

    private Optional<Node> attemptBlock(String rewritten, List<Problem> problems) {
        String wrapped = "{" + rewritten + "\n}";
        ParseResult<BlockStmt> result = new JavaParser(CONFIGURATION).parseBlock(wrapped);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            record(problems, result);
            return Optional.empty();
        }
        JavaTreeLowering lowering = new JavaTreeLowering(wrapped);
        List<Node> statements = new ArrayList<>();
        result.getResult().get().getStatements().forEach(s -> statements.addAll(lowering.lowerStatement(s)));
        if (statements.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(asRoot(statements));
    }

    private static Node asRoot(List<Node> nodes) {
        if (nodes.size() == 1) {
            return nodes.get(0);
        }
        Span span = Span.covering(nodes.get(0).span(), nodes.get(nodes.size() - 1).span());
        return Node.of(NodeKind.STATEMENTS, span, nodes);
    }

    private <T extends com.github.javaparser.ast.Node> Optional<Node> attempt(
            String text,
            EntryPoint<T> entryPoint,
            Lowerer<T> lowerer,
            List<Problem> problems) {
        ParseResult<T> result = entryPoint.parse(new JavaParser(CONFIGURATION), text);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            record(problems, result);
            return Optional.empty();
        }
        return lowerer.lower(new JavaTreeLowering(text), result.getResult());
    }

    private static void record(List<Problem> problems, ParseResult<?> result) {
        if (problems.isEmpty()) {
            problems.addAll(result.getProblems());
        }
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "unknown syntax error";
        }
        return problems.stream().map(Problem::getMessage).limit(3).collect(Collectors.joining("; "));
    }

    @FunctionalInterface
    private interface EntryPoint<T extends com.github.javaparser.ast.Node> {
        ParseResult<T> parse(JavaParser parser, String text);
    }

    @FunctionalInterface
    private interface Lowerer<T> {
        Optional<Node> lower(JavaTreeLowering lowering, Optional<T> parsed);
    }
}
