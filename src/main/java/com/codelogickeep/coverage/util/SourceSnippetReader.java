package com.codelogickeep.coverage.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads single source lines for uncovered-code records. Each file is read at most once
 * per reader; unreadable files yield null snippets.
 */
public class SourceSnippetReader {
    private static final Logger log = LoggerFactory.getLogger(SourceSnippetReader.class);

    private final Map<String, List<String>> cache = new HashMap<>();

    /**
     * Returns the trimmed text of a 1-based line, or null when the file or line is unavailable.
     *
     * @param filePath    path as written in the coverage report
     * @param sourceRoots roots used to resolve a relative path
     */
    public String readLine(String filePath, List<String> sourceRoots, int lineNumber) {
        if (filePath == null || filePath.isEmpty() || lineNumber <= 0) {
            return null;
        }
        List<String> lines = cache.computeIfAbsent(filePath, key -> load(key, sourceRoots));
        if (lineNumber > lines.size()) {
            return null;
        }
        return lines.get(lineNumber - 1).trim();
    }

    private List<String> load(String filePath, List<String> sourceRoots) {
        Path file = resolve(filePath, sourceRoots);
        if (file == null) {
            log.debug("Source file not found: {}", filePath);
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            log.debug("Source file is not UTF-8: {}", file);
            return List.of();
        } catch (IOException | UncheckedIOException e) {
            log.debug("Failed to read source file {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private static Path resolve(String filePath, List<String> sourceRoots) {
        try {
            Path direct = Paths.get(filePath);
            if (direct.isAbsolute() && Files.isRegularFile(direct)) {
                return direct;
            }
            if (sourceRoots != null) {
                for (String root : sourceRoots) {
                    Path candidate = Paths.get(root).resolve(filePath);
                    if (Files.isRegularFile(candidate)) {
                        return candidate;
                    }
                }
            }
            return Files.isRegularFile(direct) ? direct : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
