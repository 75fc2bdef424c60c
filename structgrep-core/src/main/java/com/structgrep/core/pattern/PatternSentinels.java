package com.structgrep.core.pattern;

/**
 * Identifiers that front ends substitute for pattern-only syntax before handing pattern text to
 * their grammar. The {@link PatternCompiler} recognises them in the lowered tree and replaces
 * them with marker nodes.
 *
 * <table>
 *   <caption>Pattern syntax and its sentinel</caption>
 *   <tr><th>Pattern</th><th>Sentinel</th></tr>
 *   <tr><td>{@code ...}</td><td>{@value #ELLIPSIS}</td></tr>
 *   <tr><td>{@code <... e ...>}</td><td>{@value #DEEP}{@code (e)}</td></tr>
 *   <tr><td>{@code $...ARGS}</td><td>{@value #VARIADIC_PREFIX}{@code ARGS}</td></tr>
 *   <tr><td>{@code "..."}</td><td>the literal itself</td></tr>
 * </table>
 */
public final class PatternSentinels {

    public static final String ELLIPSIS = "$__ELLIPSIS__";
    public static final String DEEP = "$__DEEP__";
    public static final String VARIADIC_PREFIX = "$__VARIADIC__";
    public static final String STRING_ELLIPSIS = "\"...\"";

    private PatternSentinels() {
        // Constants class
    }

    /**
     * Sentinel identifier for a variadic metavariable.
     *
     * @param name name without the {@code $...} prefix, e.g. {@code ARGS}
     * @return sentinel identifier
     */
    public static String variadic(String name) {
        return VARIADIC_PREFIX + name;
    }

    public static boolean isVariadic(String identifier) {
        return identifier.startsWith(VARIADIC_PREFIX) && identifier.length() > VARIADIC_PREFIX.length();
    }

    /**
     * Metavariable name a variadic sentinel stands for, e.g. {@code $...ARGS}.
     */
    public static String variadicName(String identifier) {
        return "$..." + identifier.substring(VARIADIC_PREFIX.length());
    }
}
