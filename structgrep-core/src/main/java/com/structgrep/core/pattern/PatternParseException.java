package com.structgrep.core.pattern;

/**
 * Raised when pattern text cannot be compiled: it does not parse in its language, or it uses
 * pattern syntax where that syntax is not allowed.
 */
public class PatternParseException extends RuntimeException {

    private final String language;
    private final String pattern;

    public PatternParseException(String language, String pattern, String message) {
        super(message);
        this.language = language;
        this.pattern = pattern;
    }

    public PatternParseException(String language, String pattern, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
        this.pattern = pattern;
    }

    public String getLanguage() {
        return language;
    }

    public String getPattern() {
        return pattern;
    }
}
