package com.structgrep.core.pattern;

import com.structgrep.core.lang.FrontEndException;
import com.structgrep.core.lang.FrontEnds;
import com.structgrep.core.lang.LanguageFrontEnd;
import com.structgrep.core.tree.Category;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Compiles pattern text into a {@link PatternTree}.
 *
 * <p>The language front end parses the pattern with the same grammar it uses for targets, after
 * rewriting pattern-only syntax into {@link PatternSentinels sentinels}. This compiler then walks
 * the plain tree and replaces:
 * <ul>
 *   <li>identifiers and type names spelled {@code $NAME} with metavariables, tagged with the
 *       category of the slot they occupy;</li>
 *   <li>ellipsis sentinels, alone or inside their argument, statement, parameter or field
 *       wrapper, with ellipses;</li>
 *   <li>calls to the deep sentinel with deep ellipses;</li>
 *   <li>variadic sentinels with variadic metavariables, only inside lists that allow them;</li>
 *   <li>the {@code "..."} string literal with a string ellipsis.</li>
 * </ul>
 *
 * <p>Compilation is pure, so results are cached per (language, pattern text).
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * PatternCompiler compiler = new PatternCompiler();
 * PatternTree pattern = compiler.compile("java", "$X.equals($X)");
 * }</pre>
 */
public final class PatternCompiler {

    private static final Logger log = LoggerFactory.getLogger(PatternCompiler.class);

    private static final Pattern METAVARIABLE = Pattern.compile("^\\$[A-Z_][A-Z_0-9]*$");

    private final Map<CacheKey, PatternTree> cache = new ConcurrentHashMap<>();

    /**
     * Compiles a pattern, reusing an earlier result for the same language and text.
     *
     * @param language language identifier, e.g. {@code java}
     * @param patternSource pattern text
     * @return compiled pattern, shared by all callers
     * @throws PatternParseException if the language is unknown, the text does not parse, or
     *                               pattern syntax is misplaced
     */
    public PatternTree compile(String language, String patternSource) {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(patternSource, "patternSource must not be null");
        CacheKey key = new CacheKey(language, patternSource);
        PatternTree cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        PatternTree compiled = doCompile(language, patternSource);
        PatternTree existing = cache.putIfAbsent(key, compiled);
        return existing != null ? existing : compiled;
    }

    public int cacheSize() {
        return cache.size();
    }

    private PatternTree doCompile(String language, String patternSource) {
        if (patternSource.isBlank()) {
            throw new PatternParseException(language, patternSource, "Pattern is empty");
        }
        LanguageFrontEnd frontEnd = FrontEnds.forLanguage(language)
            .orElseThrow(() -> new PatternParseException(language, patternSource,
                "No front end registered for language: " + language));

        Node plain;
        try {
            plain = frontEnd.parsePattern(patternSource);
        } catch (FrontEndException e) {
            throw new PatternParseException(language, patternSource, e.getMessage(), e);
        }

        Set<String> metavariables = new LinkedHashSet<>();
        Node root = new Conversion(language, patternSource, metavariables).convert(plain, null);
        log.debug("Compiled pattern '{}' to {}", patternSource.strip(), root);
        return new PatternTree(language, patternSource, root, metavariables);
    }

    /**
     * Returns true if the identifier is spelled like a metavariable ({@code $} followed by
     * uppercase letters, digits and underscores).
     */
    public static boolean isMetavariableName(String identifier) {
        return METAVARIABLE.matcher(identifier).matches()
            && !identifier.equals(PatternSentinels.ELLIPSIS)
            && !identifier.equals(PatternSentinels.DEEP)
            && !PatternSentinels.isVariadic(identifier);
    }

    /**
     * One pass over one plain pattern tree.
     */
    private static final class Conversion {

        private final String language;
        private final String source;
        private final Set<String> metavariables;

        Conversion(String language, String source, Set<String> metavariables) {
            this.language = language;
            this.source = source;
            this.metavariables = metavariables;
        }

        Node convert(Node node, NodeKind parent) {
            if (isEllipsis(node)) {
                return Node.marker(NodeKind.ELLIPSIS, node.category(), "...", node.span(), List.of());
            }
            String variadic = variadicName(node);
            if (variadic != null) {
                if (parent == null || !parent.allowsVariadic()) {
                    throw new PatternParseException(language, source, "Variadic metavariable " + variadic
                        + " must appear inside an argument or parameter list");
                }
                metavariables.add(variadic);
                return Node.marker(NodeKind.VARIADIC_METAVARIABLE, Category.LIST, variadic, node.span(), List.of());
            }
            if (isDeepEllipsis(node)) {
                Node inner = node.child(1).child(0).child(0);
                return Node.marker(NodeKind.DEEP_ELLIPSIS, node.category(), "<...>", node.span(),
                    List.of(convert(inner, null)));
            }
            if ((node.is(NodeKind.IDENTIFIER) || node.is(NodeKind.TYPE_NAME) && node.childCount() == 0)
                && isMetavariableName(node.value())) {
                metavariables.add(node.value());
                return Node.marker(NodeKind.METAVARIABLE, node.category(), node.value(), node.span(), List.of());
            }
            if (node.is(NodeKind.STRING_LITERAL) && node.value().equals(PatternSentinels.STRING_ELLIPSIS)) {
                return Node.marker(NodeKind.STRING_ELLIPSIS, node.category(), node.value(), node.span(), List.of());
            }
            if (node.childCount() == 0) {
                return node;
            }
            List<Node> children = new ArrayList<>(node.childCount());
            for (Node child : node.children()) {
                children.add(convert(child, node.kind()));
            }
            return node.withChildren(children);
        }

        /**
         * The ellipsis sentinel, bare or as the only content of a list element wrapper.
         */
        private static boolean isEllipsis(Node node) {
            return switch (node.kind()) {
                case IDENTIFIER -> node.value().equals(PatternSentinels.ELLIPSIS);
                case ARGUMENT, EXPRESSION_STATEMENT -> node.childCount() == 1 && isSentinel(node.child(0), PatternSentinels.ELLIPSIS);
                // Object $__ELLIPSIS__ with no initializer
                case PARAMETER, FIELD, LOCAL_VARIABLE -> node.childCount() == 3
                    && isSentinel(node.child(2), PatternSentinels.ELLIPSIS);
                default -> false;
            };
        }

        private static String variadicName(Node node) {
            Node name = switch (node.kind()) {
                case IDENTIFIER -> node;
                case ARGUMENT -> node.childCount() == 1 ? node.child(0) : null;
                case PARAMETER -> node.childCount() == 3 ? node.child(2) : null;
                default -> null;
            };
            if (name != null && name.is(NodeKind.IDENTIFIER) && PatternSentinels.isVariadic(name.value())) {
                return PatternSentinels.variadicName(name.value());
            }
            return null;
        }

        private static boolean isDeepEllipsis(Node node) {
            return node.is(NodeKind.CALL)
                && isSentinel(node.child(0), PatternSentinels.DEEP)
                && node.child(1).childCount() == 1
                && node.child(1).child(0).is(NodeKind.ARGUMENT);
        }

        private static boolean isSentinel(Node node, String sentinel) {
            return node.is(NodeKind.IDENTIFIER) && node.value().equals(sentinel);
        }
    }

    private record CacheKey(String language, String source) {
    }
}
