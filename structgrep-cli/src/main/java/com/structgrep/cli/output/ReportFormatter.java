package com.structgrep.cli.output;

import com.structgrep.core.model.ScanReport;

/**
 * Renders a scan report for standard output.
 */
public interface ReportFormatter {

    /**
     * Formats the report.
     *
     * @param report scan report
     * @return rendered text, ending with a newline
     */
    String format(ScanReport report);
}
