package com.structgrep.core.formula;

/**
 * Raised for a formula that cannot be evaluated: a filter used outside a conjunction, a
 * conjunction without a positive conjunct, a reference to an unknown pattern, or a malformed
 * metavariable constraint.
 */
public class InvalidFormulaException extends RuntimeException {

    public InvalidFormulaException(String message) {
        super(message);
    }

    public InvalidFormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
