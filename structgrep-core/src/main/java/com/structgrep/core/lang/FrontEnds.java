package com.structgrep.core.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of language front ends.
 *
 * <p>Front ends are discovered once via {@link ServiceLoader} and cached in a
 * {@link ConcurrentHashMap} keyed by language identifier.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * LanguageFrontEnd java = FrontEnds.forLanguage("java")
 *     .orElseThrow(() -> new IllegalArgumentException("no Java support"));
 * SyntaxTree tree = java.parseTarget("Foo.java", source);
 * }</pre>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>This registry is thread-safe; discovery runs at most once.</p>
 *
 * @see LanguageFrontEnd
 */
public final class FrontEnds {

    private static final Logger log = LoggerFactory.getLogger(FrontEnds.class);

    private static final Map<String, LanguageFrontEnd> frontEndCache = new ConcurrentHashMap<>();
    private static volatile boolean discovered;

    private FrontEnds() {
        // Utility class - no instantiation
    }

    /**
     * Looks up the front end for a language identifier (case-insensitive).
     *
     * @param language language identifier from a rule, e.g. {@code java}
     * @return front end, or empty if no front end is registered for it
     */
    public static Optional<LanguageFrontEnd> forLanguage(String language) {
        discover();
        return Optional.ofNullable(frontEndCache.get(language.toLowerCase(Locale.ROOT)));
    }

    /**
     * Finds the front end whose extensions cover the given file name.
     */
    public static Optional<LanguageFrontEnd> forFile(String fileName) {
        discover();
        return frontEndCache.values().stream().filter(frontEnd -> frontEnd.handles(fileName)).findFirst();
    }

    /**
     * All registered front ends, sorted by language identifier.
     */
    public static List<LanguageFrontEnd> all() {
        discover();
        return List.copyOf(new TreeMap<>(frontEndCache).values());
    }

    private static void discover() {
        if (discovered) {
            return;
        }
        synchronized (FrontEnds.class) {
            if (discovered) {
                return;
            }
            log.debug("Discovering language front ends via ServiceLoader");
            for (LanguageFrontEnd frontEnd : ServiceLoader.load(LanguageFrontEnd.class)) {
                frontEndCache.putIfAbsent(frontEnd.language().toLowerCase(Locale.ROOT), frontEnd);
                log.debug("Found front end: {} ({})", frontEnd.language(), frontEnd.getClass().getSimpleName());
            }
            discovered = true;
        }
    }
}
