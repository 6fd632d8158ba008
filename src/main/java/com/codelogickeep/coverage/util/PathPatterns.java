package com.codelogickeep.coverage.util;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.regex.PatternSyntaxException;

/**
 * Path normalization and matching for report file paths, which may come from
 * another operating system than the one running the analysis.
 */
public final class PathPatterns {

    private static final String GLOB_PREFIX = "glob:";

    private PathPatterns() {
    }

    /**
     * Converts backslashes to '/', drops '.' segments and resolves '..' segments.
     * Case is preserved.
     */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String unified = path.replace('\\', '/');
        boolean absolute = unified.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment) && !segments.isEmpty() && !"..".equals(segments.peekLast())) {
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        String joined = String.join("/", segments);
        return absolute ? "/" + joined : joined;
    }

    /**
     * Whether the file path matches any pattern. A pattern matches when it equals the
     * normalized path, is a trailing path suffix of it, or is a {@code glob:} pattern
     * matching it.
     */
    public static boolean matchesAny(String filePath, Collection<String> patterns) {
        if (filePath == null || patterns == null || patterns.isEmpty()) {
            return false;
        }
        String normalized = normalize(filePath);
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            if (matches(normalized, pattern.trim())) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(String normalizedPath, String pattern) {
        if (pattern.startsWith(GLOB_PREFIX)) {
            try {
                PathMatcher matcher = FileSystems.getDefault().getPathMatcher(pattern);
                return matcher.matches(Paths.get(normalizedPath));
            } catch (PatternSyntaxException | InvalidPathException e) {
                return false;
            }
        }
        String normalizedPattern = normalize(pattern);
        return normalizedPath.equals(normalizedPattern) || normalizedPath.endsWith("/" + normalizedPattern);
    }
}
