package com.structgrep.core.engine;

import com.structgrep.core.config.EngineConfig;
import com.structgrep.core.formula.Formula;
import com.structgrep.core.model.ErrorKind;
import com.structgrep.core.model.Finding;
import com.structgrep.core.model.MetavariableCapture;
import com.structgrep.core.model.Outcome;
import com.structgrep.core.model.PairOutcome;
import com.structgrep.core.model.ScanReport;
import com.structgrep.core.pattern.PatternTree;
import com.structgrep.core.rule.Rule;
import com.structgrep.core.rule.RuleCompiler;
import com.structgrep.core.rule.RuleDefinition;
import com.structgrep.core.rule.RuleLoader;
import com.structgrep.core.tree.Category;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ScanEngine}.
 */
class ScanEngineTest {

    private static final String SELF_COMPARE = """
        class A {
            boolean same(int a, int b) {
                return a == a;
            }
        }
        """;

    @TempDir
    Path tempDir;

    private final RuleCompiler compiler = new RuleCompiler();
    private final ScanEngine engine = new ScanEngine(EngineConfig.defaults().withJobs(2));

    private List<Rule> rule(String id, String pattern) {
        return compiler.compile(new RuleDefinition(id, List.of("java"), "$X compared with itself", "ERROR",
            pattern, null, null, null, null));
    }

    private static Rule withTimeout(Rule rule, String id, Duration timeout) {
        return new Rule(id, rule.language(), rule.message(), rule.severity(), rule.formula(), rule.patterns(),
            rule.options(), timeout);
    }

    @Test
    void scan_matchingSource_reportsFindingWithRangeAndCaptures() {
        // Given
        List<Rule> rules = rule("self-compare", "$X == $X");

        // When
        ScanReport report = engine.scan(rules, List.of(new SourceFile("A.java", SELF_COMPARE)));

        // Then
        assertThat(report.errors()).isEmpty();
        assertThat(report.findings()).hasSize(1);
        Finding finding = report.findings().get(0);
        assertThat(finding.ruleId()).isEqualTo("self-compare");
        assertThat(finding.path()).isEqualTo("A.java");
        assertThat(finding.range().startLine()).isEqualTo(3);
        assertThat(finding.range().startColumn()).isEqualTo(16);
        MetavariableCapture x = finding.metavariables().get("$X");
        assertThat(x.text()).isEqualTo("a");
        assertThat(finding.renderedMessage()).isEqualTo("a compared with itself");
        assertThat(report.outcomes()).extracting(PairOutcome::outcome).containsExactly(Outcome.COMPLETED);
        assertThat(report.statistics().filesParsed()).isEqualTo(1);
        assertThat(report.statistics().findings()).isEqualTo(1);
    }

    @Test
    void scan_ruleTimingOut_affectsOnlyThatPair() {
        // Given
        Rule normal = rule("normal", "$X == $X").get(0);
        Rule slow = withTimeout(normal, "slow", Duration.ZERO);

        // When
        ScanReport report = engine.scan(List.of(slow, normal), List.of(new SourceFile("A.java", SELF_COMPARE)));

        // Then
        assertThat(report.findings()).extracting(Finding::ruleId).containsExactly("normal");
        assertThat(report.errors()).hasSize(1);
        assertThat(report.errors().get(0).kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(report.errors().get(0).ruleId()).isEqualTo("slow");
        assertThat(report.statistics().pairsTimedOut()).isEqualTo(1);
        assertThat(report.statistics().errorCounts()).containsEntry("Timeout", 1);
    }

    @Test
    void scan_invariantViolationInOneRule_isInternalErrorForThatPairOnly() {
        // Given
        Rule normal = rule("normal", "$X == $X").get(0);
        Node root = normal.patterns().get("p0").root();
        Node variadic = Node.marker(NodeKind.VARIADIC_METAVARIABLE, Category.EXPRESSION, "$...Y",
            root.child(1).span(), List.of());
        PatternTree misplaced = new PatternTree("java", "$X == $...Y",
            root.withChildren(List.of(root.child(0), variadic)), Set.of("$X", "$...Y"));
        Rule broken = new Rule("broken", normal.language(), normal.message(), normal.severity(), normal.formula(),
            Map.of("p0", misplaced), normal.options(), null);

        // When
        ScanReport report = engine.scan(List.of(broken, normal), List.of(
            new SourceFile("A.java", SELF_COMPARE),
            new SourceFile("B.java", SELF_COMPARE)));

        // Then
        assertThat(report.findings()).extracting(Finding::ruleId).containsExactly("normal", "normal");
        assertThat(report.findings()).extracting(Finding::path).containsExactly("A.java", "B.java");
        assertThat(report.errors()).hasSize(2).allSatisfy(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
            assertThat(error.ruleId()).isEqualTo("broken");
        });
        assertThat(report.outcomes()).filteredOn(outcome -> outcome.ruleId().equals("broken"))
            .extracting(PairOutcome::outcome).containsOnly(Outcome.INTERNAL_ERROR);
        assertThat(report.outcomes()).filteredOn(outcome -> outcome.ruleId().equals("normal"))
            .extracting(PairOutcome::outcome).containsOnly(Outcome.COMPLETED);
        assertThat(report.statistics().filesParsed()).isEqualTo(2);
    }

    @Test
    void scan_unexpectedFailureInOneRule_keepsOtherFindingsForTheFile() {
        // Given
        Rule normal = rule("normal", "$X == $X").get(0);
        Rule failing = new Rule("failing", normal.language(), normal.message(), normal.severity(),
            Formula.pattern("missing"), normal.patterns(), normal.options(), null);

        // When
        ScanReport report = engine.scan(List.of(normal, failing), List.of(new SourceFile("A.java", SELF_COMPARE)));

        // Then
        assertThat(report.findings()).extracting(Finding::ruleId).containsExactly("normal");
        assertThat(report.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
            assertThat(error.ruleId()).isEqualTo("failing");
            assertThat(error.message()).contains("missing");
        });
        assertThat(report.outcomes()).extracting(PairOutcome::ruleId, PairOutcome::outcome)
            .containsExactly(tuple("normal", Outcome.COMPLETED), tuple("failing", Outcome.INTERNAL_ERROR));
        assertThat(report.statistics().filesParsed()).isEqualTo(1);
    }

    @Test
    void scan_unparseableFile_reportsParseErrorAndScansOthers() {
        List<Rule> rules = rule("self-compare", "$X == $X");

        ScanReport report = engine.scan(rules, List.of(
            new SourceFile("Broken.java", "class Broken { void m( }"),
            new SourceFile("A.java", SELF_COMPARE)));

        assertThat(report.findings()).extracting(Finding::path).containsExactly("A.java");
        assertThat(report.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.PARSE_ERROR);
            assertThat(error.path()).isEqualTo("Broken.java");
        });
        assertThat(report.outcomes()).filteredOn(o -> o.path().equals("Broken.java"))
            .extracting(PairOutcome::outcome).containsExactly(Outcome.PARSE_ERROR);
        assertThat(report.statistics().filesFailed()).isEqualTo(1);
    }

    @Test
    void scan_fileWithoutApplicableRules_isSkipped() {
        ScanReport report = engine.scan(rule("r", "$X == $X"), List.of(new SourceFile("notes.txt", "a == a")));

        assertThat(report.findings()).isEmpty();
        assertThat(report.outcomes()).isEmpty();
        assertThat(report.statistics().filesSkipped()).isEqualTo(1);
    }

    @Test
    void scan_fileOverSizeLimit_isSkipped() {
        ScanEngine small = new ScanEngine(new EngineConfig(1, 5.0, 10L, null, null));

        ScanReport report = small.scan(rule("r", "$X == $X"), List.of(new SourceFile("A.java", SELF_COMPARE)));

        assertThat(report.findings()).isEmpty();
        assertThat(report.statistics().filesSkipped()).isEqualTo(1);
    }

    @Test
    void scan_unlimitedRuleTimeout_overridesEngineTimeout() {
        ScanEngine expired = new ScanEngine(EngineConfig.defaults().withTimeoutSeconds(1e-9));
        Rule normal = rule("normal", "$X == $X").get(0);
        Rule unlimited = withTimeout(normal, "unlimited", ChronoUnit.FOREVER.getDuration());

        ScanReport report = expired.scan(List.of(unlimited), List.of(new SourceFile("A.java", SELF_COMPARE)));

        assertThat(report.findings()).hasSize(1);
        assertThat(report.errors()).isEmpty();
    }

    @Test
    void scan_manyFiles_givesSameReportForAnyWorkerCount() {
        List<SourceFile> sources = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            sources.add(new SourceFile("F" + i + ".java", """
                class F {
                    void m() {
                        if (x == x) { go(y == y); }
                    }
                }
                """));
        }
        List<Rule> rules = compiler.compile(new RuleDefinition("eq", List.of("java"), "m", null,
            "$X == $X", null, null, null, null));

        ScanReport serial = new ScanEngine(EngineConfig.defaults().withJobs(1)).scan(rules, sources);
        ScanReport parallel = new ScanEngine(EngineConfig.defaults().withJobs(4)).scan(rules, sources);

        assertThat(parallel.findings()).isEqualTo(serial.findings()).hasSize(24);
        assertThat(parallel.findings()).isSortedAccordingTo(Finding.ORDER);
    }

    @Test
    void scan_formulaRule_appliesFiltersPerFile() throws IOException {
        String yaml = """
            rules:
              - id: unchecked-get
                languages: [java]
                message: "$M.get() without isPresent check"
                patterns:
                  - pattern: $M.get()
                  - pattern-not-inside: |
                      if ($M.isPresent()) { ... }
            """;
        List<Rule> rules = compiler.compileAll(RuleLoader.parse(yaml)).rules();

        ScanReport report = engine.scan(rules, List.of(new SourceFile("Opt.java", """
            class Opt {
                void m() {
                    if (first.isPresent()) {
                        first.get();
                    }
                    second.get();
                }
            }
            """)));

        assertThat(report.findings()).singleElement()
            .satisfies(finding -> assertThat(finding.renderedMessage()).isEqualTo("second.get() without isPresent check"));
    }

    @Test
    void scanPaths_walksDirectoriesHonouringExcludes() throws IOException {
        // Given
        Files.createDirectories(tempDir.resolve("src/pkg"));
        Files.createDirectories(tempDir.resolve("build"));
        Files.createDirectories(tempDir.resolve(".git"));
        Files.writeString(tempDir.resolve("src/pkg/A.java"), SELF_COMPARE);
        Files.writeString(tempDir.resolve("build/B.java"), SELF_COMPARE);
        Files.writeString(tempDir.resolve(".git/C.java"), SELF_COMPARE);
        Files.writeString(tempDir.resolve("src/readme.md"), "a == a");
        ScanEngine excluding = new ScanEngine(EngineConfig.defaults().withExclude(List.of("build/**")));

        // When
        ScanReport report = excluding.scanPaths(rule("r", "$X == $X"), List.of(tempDir));

        // Then
        assertThat(report.statistics().filesScanned()).isEqualTo(1);
        assertThat(report.findings()).singleElement()
            .satisfies(finding -> assertThat(finding.path()).endsWith("A.java"));
    }

    @Test
    void scanPaths_missingRoot_throwsIOException() {
        Path missing = tempDir.resolve("missing");

        assertThatThrownBy(() -> engine.scanPaths(rule("r", "$X == $X"), List.of(missing)))
            .isInstanceOf(IOException.class);
    }
}
