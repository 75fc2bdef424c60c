package com.structgrep;

import com.structgrep.cli.ListCommand;
import com.structgrep.cli.LoggingOptions;
import com.structgrep.cli.ScanCommand;
import com.structgrep.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Main CLI entry point for Structgrep.
 *
 * <p>Structgrep searches source code for syntactic patterns written in the target language
 * itself, extended with metavariables ({@code $X}) and ellipses ({@code ...}).
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Run a pattern or a rule file over files and directories</li>
 *   <li>{@code validate} - Compile a rule file and report invalid rules</li>
 *   <li>{@code list} - List supported languages</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Find self-comparisons
 * structgrep scan -e '$X == $X' -l java src/
 *
 * # Run a rule file, JSON output, fail the build on findings
 * structgrep scan -c rules.yaml --json --error src/
 *
 * # List supported languages
 * structgrep list languages
 * }</pre>
 */
@Command(
    name = "structgrep",
    mixinStandardHelpOptions = true,
    version = "Structgrep 1.0.0-SNAPSHOT",
    description = "Structural code search with syntactic patterns",
    subcommands = {
        ScanCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class StructgrepCLI implements Runnable {

    @Mixin
    private LoggingOptions logging;

    @Override
    public void run() {
        logging.configure();

        if (logging.isQuiet()) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("Structgrep - Structural code search");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'structgrep --help' to see available commands");
        System.out.println("Use 'structgrep <command> --help' for command-specific help");
    }

    /**
     * Creates the configured command line, shared by {@link #main} and tests.
     *
     * @return command line
     */
    public static CommandLine commandLine() {
        return new CommandLine(new StructgrepCLI());
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
