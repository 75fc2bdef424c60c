package com.structgrep.core.model;

import java.util.Map;

/**
 * Counters collected during a scan.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanStatistics stats = report.statistics();
 * log.info(stats.getSummary());
 * // Files: 12 (parsed 11, failed 1, skipped 0), Rules: 3, Pairs: 33 (timeouts 0), Findings: 4, Time: 80 ms
 * }</pre>
 *
 * @param filesScanned files handed to the engine
 * @param filesParsed files whose front end produced a tree
 * @param filesFailed files that could not be read or parsed
 * @param filesSkipped files skipped for size or because no rule applies to their language
 * @param rules rules evaluated
 * @param pairsEvaluated (rule, file) pairs evaluated
 * @param pairsTimedOut pairs that ran out of time
 * @param findings total findings
 * @param elapsedMillis wall-clock time of the whole scan
 * @param errorCounts number of errors per {@link ErrorKind#label()}
 */
public record ScanStatistics(
    int filesScanned,
    int filesParsed,
    int filesFailed,
    int filesSkipped,
    int rules,
    int pairsEvaluated,
    int pairsTimedOut,
    int findings,
    long elapsedMillis,
    Map<String, Integer> errorCounts
) {
    public ScanStatistics {
        if (errorCounts == null) {
            errorCounts = Map.of();
        }
    }

    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0L, Map.of());
    }

    public boolean hasFailures() {
        return filesFailed > 0 || pairsTimedOut > 0 || !errorCounts.isEmpty();
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Files: %d (parsed %d, failed %d, skipped %d), Rules: %d, Pairs: %d (timeouts %d), Findings: %d, Time: %d ms",
            filesScanned, filesParsed, filesFailed, filesSkipped, rules, pairsEvaluated, pairsTimedOut, findings, elapsedMillis
        );
    }
}
