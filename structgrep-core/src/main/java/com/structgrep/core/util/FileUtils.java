package com.structgrep.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Utility class for locating and reading target files.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private FileUtils() {
        // Utility class
    }

    /**
     * Expands files and directories into the regular files to scan.
     *
     * <p>Files named explicitly are always kept. Directories are walked recursively; a walked file
     * is kept when {@code accept} holds and no exclude glob matches its path relative to the
     * directory. Hidden directories (names starting with {@code .}) are not entered. The result
     * is sorted and free of duplicates.
     *
     * @param roots files or directories
     * @param excludeGlobs glob patterns, e.g. {@code build/**}
     * @param accept filter for walked files, typically "some front end handles the extension"
     * @return sorted list of files
     * @throws IOException if a root does not exist or directory traversal fails
     */
    public static List<Path> collectTargets(List<Path> roots, List<String> excludeGlobs, Predicate<Path> accept)
            throws IOException {
        List<PathMatcher> excludes = excludeGlobs.stream()
            .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
            .toList();

        Set<Path> targets = new LinkedHashSet<>();
        for (Path root : roots) {
            if (Files.isRegularFile(root)) {
                targets.add(root.normalize());
            } else if (Files.isDirectory(root)) {
                targets.addAll(walk(root, excludes, accept));
            } else {
                throw new IOException("Target does not exist: " + root);
            }
        }
        List<Path> sorted = new ArrayList<>(targets);
        sorted.sort(null);
        return sorted;
    }

    private static List<Path> walk(Path root, List<PathMatcher> excludes, Predicate<Path> accept) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> !isHidden(root.relativize(path)))
                .filter(path -> !isExcluded(root.relativize(path), excludes))
                .filter(accept)
                .map(Path::normalize)
                .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static boolean isHidden(Path relativePath) {
        for (Path segment : relativePath) {
            String name = segment.toString();
            if (name.startsWith(".") && !name.equals(".") && !name.equals("..")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExcluded(Path relativePath, List<PathMatcher> excludes) {
        for (PathMatcher exclude : excludes) {
            if (exclude.matches(relativePath) || exclude.matches(relativePath.getFileName())) {
                log.debug("Excluding {}", relativePath);
                return true;
            }
        }
        return false;
    }

    /**
     * Reads a file as UTF-8. Malformed byte sequences are replaced instead of failing the read.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readSource(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Gets the file extension, without the dot.
     *
     * @param path file path
     * @return extension, or an empty string when there is none
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
