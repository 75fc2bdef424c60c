package com.structgrep.cli;

import com.structgrep.core.match.MatchingOptions;
import com.structgrep.core.pattern.PatternCompiler;
import com.structgrep.core.rule.Rule;
import com.structgrep.core.rule.RuleCompiler;
import com.structgrep.core.rule.RuleDefinition;
import com.structgrep.core.rule.RuleError;
import com.structgrep.core.rule.RuleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to compile a rule file without scanning anything.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * structgrep validate -c rules.yaml
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Check that every rule in a rule file compiles",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Mixin
    private LoggingOptions logging;

    @Option(names = {"-c", "--config"}, required = true, description = "Rule file or directory of rule files (YAML)")
    private Path rulesPath;

    @Override
    public Integer call() {
        logging.configure();
        List<RuleDefinition> definitions;
        try {
            definitions = RuleLoader.load(rulesPath);
        } catch (IOException e) {
            log.error("Cannot load rules: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return ScanCommand.EXIT_FAILURE;
        }

        RuleCompiler.Result result = new RuleCompiler(new PatternCompiler(), MatchingOptions.defaults())
            .compileAll(definitions);
        for (Rule rule : result.rules()) {
            System.out.println("✓ " + rule.id() + " (" + rule.language() + ", " + rule.patterns().size() + " patterns)");
        }
        for (RuleError error : result.errors()) {
            System.out.println("✗ " + error.ruleId() + " [" + error.kind().label() + "]: " + error.message());
        }
        System.out.println();
        System.out.printf("%d valid, %d invalid%n", result.rules().size(), result.errors().size());
        return result.errors().isEmpty() ? ScanCommand.EXIT_OK : ScanCommand.EXIT_FAILURE;
    }
}
