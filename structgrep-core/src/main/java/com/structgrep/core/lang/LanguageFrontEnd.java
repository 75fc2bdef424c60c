package com.structgrep.core.lang;

import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.SyntaxTree;
import com.structgrep.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Set;

/**
 * Parser for one source language that lowers its native syntax tree into the generic tree.
 *
 * <p>Front ends are discovered via Java Service Provider Interface (SPI) and looked up through
 * {@link FrontEnds}. Implementations must be stateless or thread-safe: one instance parses files
 * for every worker thread.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.structgrep.core.lang.LanguageFrontEnd}
 *
 * @see FrontEnds
 */
public interface LanguageFrontEnd {

    /**
     * Returns the language identifier used in rules, e.g. {@code "java"}.
     *
     * @return lowercase language identifier
     */
    String language();

    /**
     * Returns file extensions (without the dot) handled by this front end.
     *
     * @return file extensions
     */
    Set<String> fileExtensions();

    /**
     * Parses a target file.
     *
     * <p>The returned tree contains no pattern markers and satisfies the node kind shape
     * contract.
     *
     * @param path path reported in findings
     * @param source file contents
     * @return lowered tree
     * @throws FrontEndException if the source does not parse
     */
    SyntaxTree parseTarget(String path, String source);

    /**
     * Parses pattern source into a plain generic tree.
     *
     * <p>The front end may rewrite pattern-only syntax ({@code ...}, {@code <... e ...>},
     * {@code $...X}) into sentinel identifiers its grammar accepts; the pattern compiler turns
     * those sentinels into markers afterwards.
     *
     * @param patternSource pattern text
     * @return root of the lowered pattern
     * @throws FrontEndException if no pattern entry point accepts the text
     */
    Node parsePattern(String patternSource);

    /**
     * Returns true if the file name has one of this front end's extensions.
     */
    default boolean handles(String fileName) {
        return fileExtensions().contains(FileUtils.getExtension(Path.of(fileName)));
    }
}
