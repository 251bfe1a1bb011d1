package com.purchasingpower.codesearch.core;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Helpers for the relative, {@code /}-separated paths used throughout the index.
 */
public final class SourcePaths {

    private SourcePaths() {
    }

    /**
     * Convert a caller supplied path to the index form.
     *
     * <p>Absolute paths under {@code root} are relativized; relative paths are
     * cleaned of {@code ./} prefixes and trailing separators. A blank input
     * yields an empty string.
     */
    public static String toRelative(Path root, String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        String cleaned = relativizeIfAbsolute(root, path.trim().replace('\\', '/'));
        while (cleaned.startsWith("./")) {
            cleaned = cleaned.substring(2);
        }
        while (cleaned.endsWith("/") && cleaned.length() > 1) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return cleaned.equals(".") ? "" : cleaned;
    }

    private static String relativizeIfAbsolute(Path root, String path) {
        if (root == null) {
            return path;
        }
        try {
            Path candidate = Paths.get(path);
            if (candidate.isAbsolute() && candidate.normalize().startsWith(root)) {
                return root.relativize(candidate.normalize()).toString().replace('\\', '/');
            }
            return path;
        } catch (InvalidPathException e) {
            return path;
        }
    }

    /**
     * Whether {@code filePath} lies under {@code scope}, matching whole path segments.
     * An empty scope contains every path.
     */
    public static boolean inScope(String filePath, String scope) {
        if (scope == null || scope.isEmpty()) {
            return true;
        }
        return filePath.equals(scope) || filePath.startsWith(scope + "/");
    }

    /**
     * File part of a {@code filePath::name} node key.
     */
    public static String fileOfKey(String key) {
        int separator = key.lastIndexOf(Symbol.KEY_SEPARATOR);
        return separator < 0 ? key : key.substring(0, separator);
    }

    /**
     * Name part of a {@code filePath::name} node key.
     */
    public static String nameOfKey(String key) {
        int separator = key.lastIndexOf(Symbol.KEY_SEPARATOR);
        return separator < 0 ? key : key.substring(separator + Symbol.KEY_SEPARATOR.length());
    }
}
