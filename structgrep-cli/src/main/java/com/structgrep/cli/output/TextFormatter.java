package com.structgrep.cli.output;

import com.structgrep.core.model.Finding;
import com.structgrep.core.model.ScanError;
import com.structgrep.core.model.ScanReport;
import com.structgrep.core.model.ScanStatistics;

import java.util.Map;
import java.util.function.Function;

/**
 * Human-readable report, one line per finding, grouped by file.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * src/Main.java
 *   12:9  WARNING  string-equality  Comparing name with == compares references
 *       if (name == other) {
 *
 * 1 finding in 1 file (3 files scanned, 1 rule)
 * }</pre>
 */
public class TextFormatter implements ReportFormatter {

    private final Function<String, String> lineSource;

    /**
     * @param lineSource returns the source text of a file, or {@code null} when unavailable;
     *                   used to print the first matched line under each finding
     */
    public TextFormatter(Function<String, String> lineSource) {
        this.lineSource = lineSource;
    }

    @Override
    public String format(ScanReport report) {
        StringBuilder sb = new StringBuilder();
        String currentPath = null;
        String currentSource = null;
        for (Finding finding : report.findings()) {
            if (!finding.path().equals(currentPath)) {
                if (currentPath != null) {
                    sb.append('\n');
                }
                currentPath = finding.path();
                currentSource = lineSource != null ? lineSource.apply(currentPath) : null;
                sb.append(currentPath).append('\n');
            }
            sb.append(String.format("  %d:%d  %-7s  %s  %s%n",
                finding.range().startLine(),
                finding.range().startColumn(),
                finding.severity(),
                finding.ruleId(),
                finding.renderedMessage()));
            String line = line(currentSource, finding.range().startLine());
            if (line != null) {
                sb.append("      ").append(line.strip()).append('\n');
            }
        }

        if (!report.errors().isEmpty()) {
            if (report.hasFindings()) {
                sb.append('\n');
            }
            sb.append("Errors:\n");
            for (ScanError error : report.errors()) {
                sb.append("  [").append(error.kind().label()).append("] ");
                if (error.path() != null) {
                    sb.append(error.path()).append(": ");
                }
                if (error.ruleId() != null) {
                    sb.append(error.ruleId()).append(": ");
                }
                sb.append(error.message()).append('\n');
            }
        }

        ScanStatistics stats = report.statistics();
        long files = report.findings().stream().map(Finding::path).distinct().count();
        sb.append('\n')
            .append(report.findings().size()).append(report.findings().size() == 1 ? " finding" : " findings")
            .append(" in ").append(files).append(files == 1 ? " file" : " files")
            .append(" (").append(stats.filesScanned()).append(" files scanned, ")
            .append(stats.rules()).append(stats.rules() == 1 ? " rule" : " rules").append(")\n");
        for (Map.Entry<String, Integer> entry : stats.errorCounts().entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    private static String line(String source, int lineNumber) {
        if (source == null) {
            return null;
        }
        String[] lines = source.split("\\r\\n|\\r|\\n", -1);
        return lineNumber >= 1 && lineNumber <= lines.length ? lines[lineNumber - 1] : null;
    }
}
