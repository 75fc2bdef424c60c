package com.structgrep.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One reported match of a rule in a file.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Finding finding = new Finding(
 *     "no-string-equality",
 *     "src/Main.java",
 *     range,
 *     "Use equals() instead of == on $X",
 *     Severity.WARNING,
 *     Map.of("$X", capture)
 * );
 * String message = finding.renderedMessage(); // "Use equals() instead of == on name"
 * }</pre>
 *
 * @param ruleId id of the rule that produced the finding
 * @param path file the finding is in
 * @param range matched code
 * @param message rule message, metavariables not yet substituted
 * @param severity rule severity
 * @param metavariables bound metavariables by name
 */
public record Finding(
    String ruleId,
    String path,
    SourceRange range,
    String message,
    Severity severity,
    Map<String, MetavariableCapture> metavariables
) {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(?:\\.\\.\\.)?[A-Z_][A-Z_0-9]*");

    /**
     * Orders findings by path, then range, then rule id.
     */
    public static final Comparator<Finding> ORDER = Comparator.comparing(Finding::path)
        .thenComparing(Finding::range)
        .thenComparing(Finding::ruleId);

    public Finding {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(range, "range must not be null");
        if (message == null) {
            message = "";
        }
        if (severity == null) {
            severity = Severity.WARNING;
        }
        metavariables = metavariables == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(metavariables));
    }

    /**
     * Substitutes bound metavariables into the message. Unbound placeholders stay as written.
     *
     * @return message with {@code $X} replaced by the bound source text
     */
    public String renderedMessage() {
        Matcher matcher = PLACEHOLDER.matcher(message);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            MetavariableCapture capture = metavariables.get(matcher.group());
            String replacement = capture != null ? capture.text() : matcher.group();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
