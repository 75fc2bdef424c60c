package com.structgrep.cli;

import com.structgrep.core.lang.FrontEnds;
import com.structgrep.core.lang.LanguageFrontEnd;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list supported languages.
 *
 * <p>Front ends are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * structgrep list languages
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported languages",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Mixin
    private LoggingOptions logging;

    @Parameters(
        index = "0",
        description = "Type to list: languages"
    )
    private String type;

    @Override
    public Integer call() {
        logging.configure();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "languages", "language", "langs" -> listLanguages();
            default -> {
                log.error("Unknown type: {}. Use: languages", type);
                System.err.println("Unknown type: " + type + ". Use: languages");
                yield ScanCommand.EXIT_FAILURE;
            }
        };
    }

    private int listLanguages() {
        System.out.println("Supported Languages:");
        System.out.println();

        List<LanguageFrontEnd> frontEnds = FrontEnds.all();
        for (LanguageFrontEnd frontEnd : frontEnds) {
            System.out.printf("  • %s (extensions: %s)%n", frontEnd.language(),
                String.join(", ", new TreeSet<>(frontEnd.fileExtensions())));
        }

        if (frontEnds.isEmpty()) {
            System.out.println("  No language front ends found.");
        }

        return ScanCommand.EXIT_OK;
    }
}
