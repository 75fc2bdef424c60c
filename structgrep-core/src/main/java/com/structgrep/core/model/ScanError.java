package com.structgrep.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A problem that prevented some (rule, file) work from completing.
 *
 * @param kind error kind
 * @param ruleId rule involved, or {@code null} for file-level errors
 * @param path file involved, or {@code null} for rule-level errors
 * @param message human-readable description
 */
public record ScanError(ErrorKind kind, String ruleId, String path, String message) {

    public static final Comparator<ScanError> ORDER = Comparator
        .comparing((ScanError error) -> error.path() == null ? "" : error.path())
        .thenComparing(error -> error.ruleId() == null ? "" : error.ruleId())
        .thenComparing(ScanError::kind)
        .thenComparing(ScanError::message);

    public ScanError {
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = "";
        }
    }
}
