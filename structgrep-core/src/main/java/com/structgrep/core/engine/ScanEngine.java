package com.structgrep.core.engine;

import com.structgrep.core.config.EngineConfig;
import com.structgrep.core.lang.FrontEndException;
import com.structgrep.core.lang.FrontEnds;
import com.structgrep.core.lang.LanguageFrontEnd;
import com.structgrep.core.match.Deadline;
import com.structgrep.core.match.MatchTimeoutException;
import com.structgrep.core.model.ErrorKind;
import com.structgrep.core.model.Finding;
import com.structgrep.core.model.Outcome;
import com.structgrep.core.model.PairOutcome;
import com.structgrep.core.model.ScanError;
import com.structgrep.core.model.ScanReport;
import com.structgrep.core.model.ScanStatistics;
import com.structgrep.core.rule.Rule;
import com.structgrep.core.tree.InvariantViolationException;
import com.structgrep.core.tree.SyntaxTree;
import com.structgrep.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs compiled rules over a set of target files.
 *
 * <p>Each file is one task on a fixed pool of {@link EngineConfig#jobs()} workers. A worker
 * reads and parses its file once, then evaluates every rule of the file's language in turn,
 * each under its own {@link Deadline}. Problems stay local to where they happen:
 * <ul>
 *   <li>a file that cannot be read or parsed yields a {@code ParseError} and no findings;</li>
 *   <li>a (rule, file) pair that exceeds its budget yields a {@code Timeout} for that pair only;</li>
 *   <li>an {@link InvariantViolationException} yields an {@code InternalError} for that pair
 *       and is logged as an error, never treated as "no match".</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanEngine engine = new ScanEngine(ConfigLoader.loadOrDefaults(Path.of("structgrep.yaml")));
 * ScanReport report = engine.scanPaths(rules, List.of(Path.of("src")));
 * report.findings().forEach(finding -> System.out.println(finding.renderedMessage()));
 * }</pre>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>A scan creates and shuts down its own pool; concurrent scans on one engine are independent.
 */
public final class ScanEngine {

    private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

    private final EngineConfig config;

    public ScanEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Scans files and directories on disk. Directories are walked for files some front end
     * handles, honouring the configured exclude globs.
     *
     * @param rules compiled rules
     * @param roots files or directories
     * @return scan report
     * @throws IOException if a root does not exist or cannot be walked
     */
    public ScanReport scanPaths(List<Rule> rules, List<Path> roots) throws IOException {
        List<Path> files = FileUtils.collectTargets(roots, config.exclude(),
            path -> FrontEnds.forFile(path.getFileName().toString()).isPresent());
        log.info("Scanning {} files with {} rules", files.size(), rules.size());
        List<Target> targets = files.stream().map(Target::onDisk).toList();
        return run(rules, targets);
    }

    /**
     * Scans in-memory sources.
     *
     * @param rules compiled rules
     * @param sources sources with their paths
     * @return scan report
     */
    public ScanReport scan(List<Rule> rules, List<SourceFile> sources) {
        List<Target> targets = sources.stream().map(Target::inMemory).toList();
        return run(rules, targets);
    }

    // ==================== Scheduling ====================

    private ScanReport run(List<Rule> rules, List<Target> targets) {
        long started = System.nanoTime();
        List<FileResult> results = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.jobs(), Math.max(1, targets.size())),
            new WorkerThreadFactory());
        try {
            List<Future<FileResult>> futures = new ArrayList<>();
            for (Target target : targets) {
                futures.add(pool.submit(() -> scanFile(rules, target)));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), targets.get(i), rules));
            }
        } finally {
            pool.shutdownNow();
        }
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        return report(rules, results, elapsedMillis);
    }

    private FileResult await(Future<FileResult> future, Target target, List<Rule> rules) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scan interrupted while waiting for " + target.path(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Unexpected failure scanning {}: {}", target.path(), cause.getMessage(), cause);
            FileResult failed = new FileResult(FileStatus.FAILED);
            failed.errors.add(new ScanError(ErrorKind.INTERNAL_ERROR, null, target.path(), String.valueOf(cause.getMessage())));
            return failed;
        }
    }

    // ==================== Per-file work ====================

    private FileResult scanFile(List<Rule> rules, Target target) {
        LanguageFrontEnd frontEnd = FrontEnds.forFile(target.path()).orElse(null);
        List<Rule> applicable = frontEnd == null
            ? List.of()
            : rules.stream().filter(rule -> rule.language().equalsIgnoreCase(frontEnd.language())).toList();
        if (applicable.isEmpty()) {
            log.debug("No rules apply to {}", target.path());
            return new FileResult(FileStatus.SKIPPED);
        }

        String source;
        try {
            source = target.read();
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", target.path(), e.getMessage());
            return failed(applicable, target, ErrorKind.PARSE_ERROR, Outcome.PARSE_ERROR, "Failed to read file: " + e.getMessage());
        }
        if (config.maxTargetBytes() > 0 && source.getBytes(StandardCharsets.UTF_8).length > config.maxTargetBytes()) {
            log.warn("Skipping {}: larger than {} bytes", target.path(), config.maxTargetBytes());
            return new FileResult(FileStatus.SKIPPED);
        }

        SyntaxTree tree;
        try {
            tree = frontEnd.parseTarget(target.path(), source);
        } catch (FrontEndException e) {
            log.warn("Failed to parse {}: {}", target.path(), e.getMessage());
            return failed(applicable, target, ErrorKind.PARSE_ERROR, Outcome.PARSE_ERROR, e.getMessage());
        } catch (InvariantViolationException e) {
            log.error("Front end produced an invalid tree for {}: {}", target.path(), e.getMessage(), e);
            return failed(applicable, target, ErrorKind.INTERNAL_ERROR, Outcome.INTERNAL_ERROR, e.getMessage());
        }

        FileResult result = new FileResult(FileStatus.PARSED);
        RuleRunner runner = new RuleRunner(tree);
        for (Rule rule : applicable) {
            runRule(rule, runner, target, result);
        }
        return result;
    }

    private void runRule(Rule rule, RuleRunner runner, Target target, FileResult result) {
        long started = System.nanoTime();
        Outcome outcome;
        int found = 0;
        try {
            List<Finding> findings = runner.run(rule, deadlineFor(rule));
            result.findings.addAll(findings);
            found = findings.size();
            outcome = Outcome.COMPLETED;
        } catch (MatchTimeoutException e) {
            log.warn("Rule {} timed out on {} after {} ms", rule.id(), target.path(), e.getBudget().toMillis());
            result.errors.add(new ScanError(ErrorKind.TIMEOUT, rule.id(), target.path(), e.getMessage()));
            outcome = Outcome.TIMEOUT;
        } catch (InvariantViolationException e) {
            log.error("Internal error evaluating rule {} on {}: {}", rule.id(), target.path(), e.getMessage(), e);
            result.errors.add(new ScanError(ErrorKind.INTERNAL_ERROR, rule.id(), target.path(), e.getMessage()));
            outcome = Outcome.INTERNAL_ERROR;
        } catch (RuntimeException e) {
            log.error("Rule {} failed on {}: {}", rule.id(), target.path(), e.getMessage(), e);
            result.errors.add(new ScanError(ErrorKind.INTERNAL_ERROR, rule.id(), target.path(), String.valueOf(e.getMessage())));
            outcome = Outcome.INTERNAL_ERROR;
        }
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        result.outcomes.add(new PairOutcome(rule.id(), target.path(), outcome, found, elapsedMillis));
    }

    private Deadline deadlineFor(Rule rule) {
        Duration budget = rule.timeout() != null ? rule.timeout() : config.timeout();
        return budget == null ? Deadline.none() : Deadline.after(budget);
    }

    private static FileResult failed(List<Rule> rules, Target target, ErrorKind kind, Outcome outcome, String message) {
        FileResult result = new FileResult(FileStatus.FAILED);
        result.errors.add(new ScanError(kind, null, target.path(), message));
        for (Rule rule : rules) {
            result.outcomes.add(new PairOutcome(rule.id(), target.path(), outcome, 0, 0L));
        }
        return result;
    }

    // ==================== Aggregation ====================

    private ScanReport report(List<Rule> rules, List<FileResult> results, long elapsedMillis) {
        List<Finding> findings = new ArrayList<>();
        List<ScanError> errors = new ArrayList<>();
        List<PairOutcome> outcomes = new ArrayList<>();
        int parsed = 0;
        int failed = 0;
        int skipped = 0;
        for (FileResult result : results) {
            findings.addAll(result.findings);
            errors.addAll(result.errors);
            outcomes.addAll(result.outcomes);
            switch (result.status) {
                case PARSED -> parsed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        Map<String, Integer> errorCounts = new TreeMap<>();
        for (ScanError error : errors) {
            errorCounts.merge(error.kind().label(), 1, Integer::sum);
        }
        int timedOut = (int) outcomes.stream().filter(outcome -> outcome.outcome() == Outcome.TIMEOUT).count();

        ScanStatistics statistics = new ScanStatistics(results.size(), parsed, failed, skipped, rules.size(),
            outcomes.size(), timedOut, findings.size(), elapsedMillis, errorCounts);
        log.info("Scan complete. {}", statistics.getSummary());
        return new ScanReport(findings, errors, outcomes, statistics);
    }

    private enum FileStatus {
        PARSED,
        FAILED,
        SKIPPED
    }

    private static final class FileResult {
        private final FileStatus status;
        private final List<Finding> findings = new ArrayList<>();
        private final List<ScanError> errors = new ArrayList<>();
        private final List<PairOutcome> outcomes = new ArrayList<>();

        FileResult(FileStatus status) {
            this.status = status;
        }
    }

    /**
     * A file to scan, either on disk (read by the worker) or already in memory.
     */
    private record Target(String path, Path file, String source) {

        static Target onDisk(Path file) {
            return new Target(file.toString(), file, null);
        }

        static Target inMemory(SourceFile source) {
            return new Target(source.path(), null, source.source());
        }

        String read() throws IOException {
            return source != null ? source : FileUtils.readSource(file);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "structgrep-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
