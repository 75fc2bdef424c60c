package com.structgrep.core.rule;

/**
 * Thrown when a rule definition is structurally malformed (missing id, unknown language,
 * conflicting operators).
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
