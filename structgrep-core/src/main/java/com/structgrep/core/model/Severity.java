package com.structgrep.core.model;

import java.util.Locale;

/**
 * Severity attached to a rule and copied onto its findings.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    /**
     * Parses a severity name case-insensitively.
     *
     * @param value name such as {@code "warning"}; {@code null} yields {@link #WARNING}
     * @return parsed severity
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return WARNING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
