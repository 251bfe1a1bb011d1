package com.purchasingpower.codesearch.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the lines around a match from disk.
 */
@Slf4j
@Component
public class SourceContextReader {

    public record Context(List<String> before, List<String> after) {

        static final Context NONE = new Context(List.of(), List.of());
    }

    /**
     * Up to {@code contextLines} lines before and after the 1-based {@code lineNumber},
     * trailing whitespace removed. A file that cannot be read yields no context.
     */
    public Context read(Path root, String filePath, int lineNumber, int contextLines) {
        List<String> lines;
        try {
            lines = Files.readAllLines(root.resolve(filePath), StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException e) {
            log.warn("⚠️  Unable to read context from {}: {}", filePath, e.getMessage());
            return Context.NONE;
        }

        int start = Math.max(0, lineNumber - contextLines - 1);
        int end = Math.min(lines.size(), lineNumber + contextLines);
        int matchIndex = Math.min(Math.max(lineNumber - 1, 0), lines.size());

        List<String> before = lines.subList(Math.min(start, matchIndex), matchIndex).stream()
            .map(String::stripTrailing)
            .toList();
        List<String> after = lineNumber < end
            ? lines.subList(lineNumber, end).stream().map(String::stripTrailing).toList()
            : List.of();
        return new Context(before, after);
    }
}
