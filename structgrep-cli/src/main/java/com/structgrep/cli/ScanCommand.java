package com.structgrep.cli;

import com.structgrep.cli.output.JsonFormatter;
import com.structgrep.cli.output.ReportFormatter;
import com.structgrep.cli.output.TextFormatter;
import com.structgrep.core.config.ConfigLoader;
import com.structgrep.core.config.EngineConfig;
import com.structgrep.core.engine.ScanEngine;
import com.structgrep.core.model.ScanError;
import com.structgrep.core.model.ScanReport;
import com.structgrep.core.pattern.PatternCompiler;
import com.structgrep.core.rule.Rule;
import com.structgrep.core.rule.RuleCompiler;
import com.structgrep.core.rule.RuleDefinition;
import com.structgrep.core.rule.RuleError;
import com.structgrep.core.rule.RuleLoader;
import com.structgrep.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to run a pattern or a rule file over source files.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load engine configuration ({@code structgrep.yaml})</li>
 *   <li>Build rule definitions from {@code -e}/{@code -l} or load them from {@code -c}</li>
 *   <li>Compile rules, reporting invalid ones</li>
 *   <li>Scan the targets in parallel</li>
 *   <li>Print findings as text or JSON</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> {@code 0} success, {@code 1} findings were reported and {@code --error}
 * was given, {@code 2} the scan could not run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Ad-hoc pattern
 * structgrep scan -e 'System.out.println(...)' -l java src/
 *
 * # Rule file, JSON output
 * structgrep scan -c rules.yaml --json .
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Search files for structural patterns",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_FAILURE = 2;

    /** Rule id used for a pattern given with {@code -e}. */
    static final String AD_HOC_RULE_ID = "-";

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Mixin
    private LoggingOptions logging;

    @Parameters(
        arity = "0..*",
        description = "Files or directories to scan (default: current directory)"
    )
    private List<Path> targets = new ArrayList<>();

    @Option(names = {"-e", "--pattern"}, description = "Pattern to search for (requires --lang)")
    private String pattern;

    @Option(names = {"-l", "--lang"}, description = "Language of the --pattern, e.g. java")
    private String language;

    @Option(names = {"-c", "--config"}, description = "Rule file or directory of rule files (YAML)")
    private Path rulesPath;

    @Option(names = {"--json"}, description = "Print results as JSON")
    private boolean json;

    @Option(names = {"--timeout"}, description = "Seconds per rule and file; 0 disables the limit (overrides config)")
    private Double timeoutSeconds;

    @Option(names = {"-j", "--jobs"}, description = "Number of parallel workers (overrides config)")
    private Integer jobs;

    @Option(names = {"--error"}, description = "Exit with code 1 if there are findings")
    private boolean errorOnFindings;

    @Option(
        names = {"--config-file"},
        description = "Engine configuration file (default: structgrep.yaml if present)"
    )
    private Path configFile;

    @Override
    public Integer call() {
        logging.configure();
        try {
            if ((pattern == null) == (rulesPath == null)) {
                System.err.println("✗ Specify either --pattern with --lang, or --config");
                return EXIT_FAILURE;
            }
            if (pattern != null && language == null) {
                System.err.println("✗ --pattern requires --lang");
                return EXIT_FAILURE;
            }

            EngineConfig config = loadConfiguration();
            List<RuleDefinition> definitions = pattern != null
                ? List.of(RuleDefinition.ofPattern(AD_HOC_RULE_ID, language, pattern))
                : RuleLoader.load(rulesPath);

            RuleCompiler.Result compiled = new RuleCompiler(new PatternCompiler(), config.matching())
                .compileAll(definitions);
            for (RuleError error : compiled.errors()) {
                System.err.println("✗ Invalid rule " + error.ruleId() + ": " + error.message());
            }
            if (compiled.rules().isEmpty()) {
                System.err.println("✗ No valid rules to run");
                return EXIT_FAILURE;
            }

            List<Rule> rules = compiled.rules();
            List<Path> roots = targets.isEmpty() ? List.of(Paths.get(".")) : targets;
            log.info("Running {} rules on {}", rules.size(), roots);
            ScanReport report = withRuleErrors(new ScanEngine(config).scanPaths(rules, roots), compiled.errors());

            System.out.print(formatter().format(report));
            return errorOnFindings && report.hasFindings() ? EXIT_FINDINGS : EXIT_OK;

        } catch (IOException e) {
            log.error("Scan failed: {}", e.getMessage());
            System.err.println("✗ Scan failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private EngineConfig loadConfiguration() {
        EngineConfig config = configFile != null
            ? ConfigLoader.load(configFile)
            : ConfigLoader.loadOrDefaults(Paths.get(ConfigLoader.DEFAULT_FILE_NAME));
        if (jobs != null) {
            config = config.withJobs(jobs);
        }
        if (timeoutSeconds != null) {
            config = config.withTimeoutSeconds(timeoutSeconds);
        }
        log.debug("Effective configuration: {}", config);
        return config;
    }

    private ReportFormatter formatter() {
        if (json) {
            return new JsonFormatter();
        }
        return new TextFormatter(path -> {
            try {
                return FileUtils.readSource(Paths.get(path));
            } catch (IOException e) {
                log.debug("Cannot read {} for context: {}", path, e.getMessage());
                return null;
            }
        });
    }

    private static ScanReport withRuleErrors(ScanReport report, List<RuleError> ruleErrors) {
        if (ruleErrors.isEmpty()) {
            return report;
        }
        List<ScanError> errors = new ArrayList<>(report.errors());
        ruleErrors.forEach(error -> errors.add(error.toScanError()));
        return new ScanReport(report.findings(), errors, report.outcomes(), report.statistics());
    }
}
