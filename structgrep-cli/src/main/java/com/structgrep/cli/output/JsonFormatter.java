package com.structgrep.cli.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.structgrep.core.model.Finding;
import com.structgrep.core.model.MetavariableCapture;
import com.structgrep.core.model.PairOutcome;
import com.structgrep.core.model.ScanError;
import com.structgrep.core.model.ScanReport;
import com.structgrep.core.model.ScanStatistics;
import com.structgrep.core.model.SourceRange;

import java.io.UncheckedIOException;

/**
 * Machine-readable report.
 *
 * <p><b>Shape:</b>
 * <pre>{@code
 * {
 *   "results": [{
 *     "check_id": "string-equality",
 *     "path": "src/Main.java",
 *     "start": {"line": 12, "col": 9, "offset": 301},
 *     "end": {"line": 12, "col": 23, "offset": 315},
 *     "extra": {
 *       "message": "Comparing name with == compares references",
 *       "severity": "WARNING",
 *       "metavars": {"$X": {"start": {...}, "end": {...}, "abstract_content": "name"}}
 *     }
 *   }],
 *   "errors": [{"type": "Timeout", "rule_id": "slow-rule", "path": "src/Big.java", "message": "..."}],
 *   "stats": {...}
 * }
 * }</pre>
 */
public class JsonFormatter implements ReportFormatter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String format(ScanReport report) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode results = root.putArray("results");
        for (Finding finding : report.findings()) {
            results.add(result(finding));
        }
        ArrayNode errors = root.putArray("errors");
        for (ScanError error : report.errors()) {
            ObjectNode node = errors.addObject();
            node.put("type", error.kind().label());
            node.put("level", "warn");
            if (error.ruleId() != null) {
                node.put("rule_id", error.ruleId());
            }
            if (error.path() != null) {
                node.put("path", error.path());
            }
            node.put("message", error.message());
        }
        root.set("stats", stats(report));
        try {
            return mapper.writeValueAsString(root) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ObjectNode result(Finding finding) {
        ObjectNode node = mapper.createObjectNode();
        node.put("check_id", finding.ruleId());
        node.put("path", finding.path());
        addPositions(node, finding.range());
        ObjectNode extra = node.putObject("extra");
        extra.put("message", finding.renderedMessage());
        extra.put("severity", finding.severity().name());
        ObjectNode metavars = extra.putObject("metavars");
        for (MetavariableCapture capture : finding.metavariables().values()) {
            ObjectNode metavar = metavars.putObject(capture.name());
            addPositions(metavar, capture.range());
            metavar.put("abstract_content", capture.text());
        }
        return node;
    }

    private static void addPositions(ObjectNode node, SourceRange range) {
        ObjectNode start = node.putObject("start");
        start.put("line", range.startLine());
        start.put("col", range.startColumn());
        start.put("offset", range.startOffset());
        ObjectNode end = node.putObject("end");
        end.put("line", range.endLine());
        end.put("col", range.endColumn());
        end.put("offset", range.endOffset());
    }

    private ObjectNode stats(ScanReport report) {
        ScanStatistics statistics = report.statistics();
        ObjectNode node = mapper.createObjectNode();
        node.put("files_scanned", statistics.filesScanned());
        node.put("files_parsed", statistics.filesParsed());
        node.put("files_failed", statistics.filesFailed());
        node.put("files_skipped", statistics.filesSkipped());
        node.put("rules", statistics.rules());
        node.put("pairs_evaluated", statistics.pairsEvaluated());
        node.put("pairs_timed_out", statistics.pairsTimedOut());
        node.put("elapsed_ms", statistics.elapsedMillis());
        ArrayNode slowest = node.putArray("slowest");
        report.outcomes().stream()
            .sorted((a, b) -> Long.compare(b.elapsedMillis(), a.elapsedMillis()))
            .limit(5)
            .forEach((PairOutcome outcome) -> {
                ObjectNode entry = slowest.addObject();
                entry.put("rule_id", outcome.ruleId());
                entry.put("path", outcome.path());
                entry.put("outcome", outcome.outcome().name());
                entry.put("elapsed_ms", outcome.elapsedMillis());
            });
        return node;
    }
}
