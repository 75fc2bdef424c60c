package com.structgrep.core.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads rule files written in YAML.
 *
 * <p>Unlike configuration, a rule file that cannot be read is an error: scanning with a silently
 * empty rule set would report a clean result.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<RuleDefinition> definitions = RuleLoader.load(Path.of("rules.yaml"));
 * }</pre>
 */
public final class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RuleLoader() {
        // Utility class
    }

    /**
     * Loads the rules of a file, or of every {@code .yaml}/{@code .yml} file below a directory.
     *
     * @param path rule file or directory
     * @return definitions in file order
     * @throws IOException if a file cannot be read or is not a valid rule file
     */
    public static List<RuleDefinition> load(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            List<Path> files;
            try (Stream<Path> walk = Files.walk(path)) {
                files = walk
                    .filter(Files::isRegularFile)
                    .filter(file -> {
                        String name = file.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .toList();
            }
            List<RuleDefinition> definitions = new ArrayList<>();
            for (Path file : files) {
                definitions.addAll(loadFile(file));
            }
            return definitions;
        }
        return loadFile(path);
    }

    /**
     * Parses rule YAML held in memory.
     *
     * @param yaml rule file content
     * @return definitions in file order
     * @throws IOException if the text is not a valid rule file
     */
    public static List<RuleDefinition> parse(String yaml) throws IOException {
        if (yaml.isBlank()) {
            return List.of();
        }
        RuleDefinition.RuleFile file = YAML_MAPPER.readValue(yaml, RuleDefinition.RuleFile.class);
        return file == null ? List.of() : file.rules();
    }

    private static List<RuleDefinition> loadFile(Path file) throws IOException {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new IOException("Rule file not found or not readable: " + file);
        }
        log.debug("Loading rules from: {}", file);
        try {
            List<RuleDefinition> definitions = parse(Files.readString(file));
            log.info("Loaded {} rules from: {}", definitions.size(), file);
            return definitions;
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid rule file " + file + ": " + e.getOriginalMessage(), e);
        }
    }
}
