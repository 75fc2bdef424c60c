package com.structgrep.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * Everything a scan produced.
 *
 * <p>Findings are sorted by (path, range, rule id), errors by (path, rule id, kind) and outcomes
 * by (path, rule id), so two scans of the same input produce equal reports apart from timings.
 *
 * @param findings sorted findings
 * @param errors sorted non-fatal errors
 * @param outcomes one entry per evaluated (rule, file) pair
 * @param statistics scan counters
 */
public record ScanReport(
    List<Finding> findings,
    List<ScanError> errors,
    List<PairOutcome> outcomes,
    ScanStatistics statistics
) {
    private static final Comparator<PairOutcome> OUTCOME_ORDER = Comparator.comparing(PairOutcome::path)
        .thenComparing(PairOutcome::ruleId);

    public ScanReport {
        findings = findings == null ? List.of() : findings.stream().sorted(Finding.ORDER).toList();
        errors = errors == null ? List.of() : errors.stream().sorted(ScanError.ORDER).toList();
        outcomes = outcomes == null ? List.of() : outcomes.stream().sorted(OUTCOME_ORDER).toList();
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Findings of one rule.
     *
     * @param ruleId rule id
     * @return findings in report order
     */
    public List<Finding> findingsFor(String ruleId) {
        return findings.stream().filter(finding -> finding.ruleId().equals(ruleId)).toList();
    }
}
