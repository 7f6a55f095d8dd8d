package com.congruence.core.workspace;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What survives in a sanitized workspace.
 *
 * @param allowedExtensions   lower-case extensions with leading dot, e.g. {@code .py}
 * @param excludedDirectories directory names removed wherever they appear
 * @param rewriteHistory      also purge excluded paths from history
 */
public record SafeModeOptions(
    Set<String> allowedExtensions,
    Set<String> excludedDirectories,
    boolean rewriteHistory
) {

    public SafeModeOptions {
        allowedExtensions = Set.copyOf(allowedExtensions);
        excludedDirectories = Set.copyOf(excludedDirectories);
    }

    public static SafeModeOptions of(Collection<String> extensions, Collection<String> directories, boolean rewriteHistory) {
        Set<String> normalized = extensions.stream()
                .map(String::trim)
                .filter(e -> !e.isEmpty())
                .map(e -> e.toLowerCase(Locale.ROOT))
                .map(e -> e.startsWith(".") ? e : "." + e)
                .collect(Collectors.toSet());
        Set<String> dirs = directories.stream()
                .map(String::trim)
                .filter(d -> !d.isEmpty())
                .collect(Collectors.toSet());
        return new SafeModeOptions(normalized, dirs, rewriteHistory);
    }

    public boolean allowsFile(String fileName) {
        return allowedExtensions.contains(extension(fileName));
    }

    public boolean excludesDirectory(String dirName) {
        return excludedDirectories.contains(dirName);
    }

    /**
     * True when a repository-relative path ({@code /}-separated) survives pruning.
     */
    public boolean allowsPath(String relativePath) {
        String[] segments = relativePath.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (excludesDirectory(segments[i])) {
                return false;
            }
        }
        return allowsFile(segments[segments.length - 1]);
    }

    /**
     * Lower-case extension including the dot; empty for dot-files and names without one.
     */
    static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
