package com.structgrep.core.engine;

import java.util.Objects;

/**
 * A target held in memory.
 *
 * @param path path used for language detection and reporting
 * @param source file content
 */
public record SourceFile(String path, String source) {

    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
