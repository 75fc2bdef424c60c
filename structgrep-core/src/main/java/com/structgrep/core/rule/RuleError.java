package com.structgrep.core.rule;

import com.structgrep.core.model.ErrorKind;
import com.structgrep.core.model.ScanError;

import java.util.Objects;

/**
 * Diagnostic for a rule that could not be compiled. The rule is skipped; other rules still run.
 *
 * @param ruleId id of the offending rule
 * @param kind {@link ErrorKind#PATTERN_PARSE_ERROR} or {@link ErrorKind#INVALID_RULE}
 * @param message description
 */
public record RuleError(String ruleId, ErrorKind kind, String message) {

    public RuleError {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = "";
        }
    }

    public ScanError toScanError() {
        return new ScanError(kind, ruleId, null, message);
    }
}
