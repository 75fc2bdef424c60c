package com.structgrep.core.model;

/**
 * Kind of a non-fatal problem reported alongside findings.
 */
public enum ErrorKind {
    PATTERN_PARSE_ERROR("PatternParseError"),
    INVALID_RULE("InvalidRuleError"),
    PARSE_ERROR("ParseError"),
    TIMEOUT("Timeout"),
    INTERNAL_ERROR("InternalError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    /**
     * Name used in JSON output.
     */
    public String label() {
        return label;
    }
}
