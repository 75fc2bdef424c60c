package com.structgrep.core.lang.java;

import com.structgrep.core.pattern.PatternSentinels;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Rewrites pattern-only syntax into sentinel identifiers that JavaParser accepts.
 *
 * <p>A small lexer walks the pattern, copying strings, characters and comments verbatim, and
 * decides what each {@code ...} stands for from the surrounding tokens:
 * <ul>
 *   <li>after an identifier it is the varargs token of a parameter and is kept;</li>
 *   <li>inside the parameter list of a declaration header or a {@code catch} clause it becomes
 *       a parameter {@code Object $__ELLIPSIS__};</li>
 *   <li>where a statement may start it becomes a statement, or a field inside a class body;</li>
 *   <li>anywhere else it becomes an expression.</li>
 * </ul>
 * {@code <...} and a matching {@code ...>} wrap the enclosed expression in a call to the deep
 * sentinel. {@code $...NAME} becomes a variadic sentinel identifier.
 */
final class JavaPatternRewriter {

    private static final Set<String> KEYWORDS = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while", "yield", "record");

    private static final Set<String> TYPE_KEYWORDS = Set.of("class", "interface", "enum", "record");

    private static final Set<String> STATEMENT_STARTS = Set.of("{", "}", ";", "else", "do");

    private final String source;
    private final StringBuilder out = new StringBuilder();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private String previous = ";";
    private boolean typeKeywordSeen;
    private boolean afterNew;
    private int deepDepth;
    private int pos;

    private JavaPatternRewriter(String source) {
        this.source = source;
    }

    static String rewrite(String pattern) {
        return new JavaPatternRewriter(pattern).run();
    }

    private String run() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                out.append(c);
                pos++;
            } else if (source.startsWith("//", pos)) {
                copyUntil(source.indexOf('\n', pos));
            } else if (source.startsWith("/*", pos)) {
                int end = source.indexOf("*/", pos + 2);
                copyUntil(end < 0 ? -1 : end + 2);
            } else if (source.startsWith("\"\"\"", pos)) {
                copyTextBlock();
            } else if (c == '"' || c == '\'') {
                copyQuoted(c);
            } else if (source.startsWith("<...", pos)) {
                emit(PatternSentinels.DEEP + "(", "(");
                frames.push(Frame.PAREN);
                deepDepth++;
                pos += 4;
            } else if (deepDepth > 0 && source.startsWith("...>", pos)) {
                popParen();
                emit(")", ")");
                deepDepth--;
                pos += 4;
            } else if (c == '$' && source.startsWith("...", pos + 1) && isNameStart(pos + 4)) {
                rewriteVariadic();
            } else if (source.startsWith("...", pos)) {
                rewriteEllipsis();
            } else if (Character.isJavaIdentifierStart(c) || Character.isDigit(c)) {
                word();
            } else {
                punctuation(c);
            }
        }
        return out.toString();
    }

    // ==================== Pattern syntax ====================

    private void rewriteVariadic() {
        int start = pos + 4;
        int end = start;
        while (end < source.length() && Character.isJavaIdentifierPart(source.charAt(end))) {
            end++;
        }
        String sentinel = PatternSentinels.variadic(source.substring(start, end));
        emit(frames.peek() == Frame.HEADER ? "Object " + sentinel : sentinel, sentinel);
        pos = end;
    }

    private void rewriteEllipsis() {
        pos += 3;
        if (isIdentifier(previous) && !KEYWORDS.contains(previous) || previous.equals("]") || previous.equals(">")) {
            emit("...", "...");
            return;
        }
        Frame frame = frames.peek();
        if (frame == Frame.HEADER) {
            emit("Object " + PatternSentinels.ELLIPSIS, PatternSentinels.ELLIPSIS);
        } else if ((frame == null || frame.isBrace()) && STATEMENT_STARTS.contains(previous)) {
            String declaration = frame == Frame.CLASS_BODY ? "Object " + PatternSentinels.ELLIPSIS : PatternSentinels.ELLIPSIS;
            if (nextSignificant() == ';') {
                emit(declaration, PatternSentinels.ELLIPSIS);
            } else {
                emit(declaration + ";", ";");
            }
        } else {
            emit(PatternSentinels.ELLIPSIS, PatternSentinels.ELLIPSIS);
        }
    }

    // ==================== Ordinary tokens ====================

    private void word() {
        int end = pos;
        while (end < source.length() && Character.isJavaIdentifierPart(source.charAt(end))) {
            end++;
        }
        String word = source.substring(pos, end);
        if (TYPE_KEYWORDS.contains(word)) {
            typeKeywordSeen = true;
        }
        if (word.equals("new")) {
            afterNew = true;
        }
        emit(word, word);
        pos = end;
    }

    private void punctuation(char c) {
        pos++;
        if (c == '-' && pos < source.length() && source.charAt(pos) == '>') {
            pos++;
            emit("->", "->");
            return;
        }
        switch (c) {
            case '(' -> {
                boolean header = previous.equals("catch")
                    || !afterNew && isIdentifier(previous) && !KEYWORDS.contains(previous) && opensDeclarationBody(pos);
                frames.push(header ? Frame.HEADER : Frame.PAREN);
                afterNew = false;
            }
            case ')' -> popParen();
            case '{' -> {
                frames.push(typeKeywordSeen ? Frame.CLASS_BODY : Frame.BLOCK);
                typeKeywordSeen = false;
                afterNew = false;
            }
            case '}' -> {
                if (!frames.isEmpty() && frames.peek().isBrace()) {
                    frames.pop();
                }
            }
            case ';' -> {
                typeKeywordSeen = false;
                afterNew = false;
            }
            default -> {
                // other punctuation does not change the context
            }
        }
        emit(String.valueOf(c), String.valueOf(c));
    }

    private void popParen() {
        if (!frames.isEmpty() && !frames.peek().isBrace()) {
            frames.pop();
        }
    }

    /**
     * Returns true if the parenthesis opened just before {@code from} is followed, after its
     * match, by a body or a {@code throws} clause.
     */
    private boolean opensDeclarationBody(int from) {
        int depth = 1;
        int i = from;
        while (i < source.length() && depth > 0) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipQuoted(i, c);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
            i++;
        }
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return source.startsWith("{", i) || source.startsWith("throws", i);
    }

    // ==================== Copying ====================

    private void copyUntil(int end) {
        int stop = end < 0 ? source.length() : end;
        out.append(source, pos, stop);
        pos = stop;
    }

    private void copyTextBlock() {
        int end = source.indexOf("\"\"\"", pos + 3);
        while (end > 0 && source.charAt(end - 1) == '\\') {
            end = source.indexOf("\"\"\"", end + 1);
        }
        copyUntil(end < 0 ? -1 : end + 3);
        previous = "\"";
    }

    private void copyQuoted(char quote) {
        int end = skipQuoted(pos, quote);
        out.append(source, pos, end);
        pos = end;
        previous = String.valueOf(quote);
    }

    private int skipQuoted(int start, char quote) {
        int i = start + 1;
        while (i < source.length() && source.charAt(i) != quote) {
            i += source.charAt(i) == '\\' ? 2 : 1;
        }
        return Math.min(i + 1, source.length());
    }

    private void emit(String text, String token) {
        out.append(text);
        previous = token;
    }

    private char nextSignificant() {
        int i = pos;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private boolean isNameStart(int index) {
        return index < source.length() && Character.isJavaIdentifierStart(source.charAt(index));
    }

    private static boolean isIdentifier(String token) {
        return !token.isEmpty() && Character.isJavaIdentifierStart(token.charAt(0));
    }

    private enum Frame {
        PAREN, HEADER, BLOCK, CLASS_BODY;

        boolean isBrace() {
            return this == BLOCK || this == CLASS_BODY;
        }
    }
}
