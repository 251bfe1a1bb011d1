package com.purchasingpower.codesearch.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the code search engine.
 *
 * <p>Properties are loaded from the {@code codesearch} namespace in application.yml.
 * Example configuration:
 * <pre>
 * codesearch:
 *   default-extensions: [".py", ".js", ".java"]
 *   exclude-dirs: ["node_modules", ".git"]
 *   index-timeout: 5m
 *   extraction-threads: 4
 *   search:
 *     context-lines: 3
 *     cache-max-entries: 512
 *   pattern:
 *     threshold: 0.7
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "codesearch")
public class CodeSearchProperties {

    /**
     * Extensions indexed when the caller does not supply any.
     */
    @NotEmpty
    private List<String> defaultExtensions = new ArrayList<>(List.of(
        ".py", ".js", ".ts", ".jsx", ".tsx", ".java", ".go", ".rs"));

    /**
     * Directory names pruned during scanning when the caller does not supply any.
     */
    @NotNull
    private List<String> excludeDirs = new ArrayList<>(List.of(
        "node_modules", ".git", "__pycache__", "venv", ".venv", "dist", "build", "target", ".idea"));

    /**
     * Wall-clock budget for one rebuild. A rebuild running past it is abandoned
     * and the previous snapshot stays current.
     */
    @NotNull
    private Duration indexTimeout = Duration.ofMinutes(5);

    @Min(1)
    private int extractionThreads = 4;

    /**
     * Files larger than this are skipped by the scanner.
     */
    @Min(1)
    private long maxFileSizeBytes = 2L * 1024 * 1024;

    @Valid
    @NotNull
    private Search search = new Search();

    @Valid
    @NotNull
    private Pattern pattern = new Pattern();

    @Valid
    @NotNull
    private DeadCode deadCode = new DeadCode();

    @Data
    public static class Search {

        @Min(0)
        private int contextLines = 3;

        @Min(1)
        private int defaultMaxResults = 20;

        /**
         * Upper bound of (query, scope) entries kept per snapshot generation.
         */
        @Min(1)
        private long cacheMaxEntries = 512;
    }

    @Data
    public static class Pattern {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold = 0.7;

        @Min(1)
        private int maxResults = 20;
    }

    @Data
    public static class DeadCode {

        /**
         * Names never reported as dead code, in addition to underscore-prefixed names.
         */
        @NotNull
        private List<String> entryPoints = new ArrayList<>(List.of(
            "main", "__init__", "constructor", "init", "new", "toString", "equals", "hashCode"));
    }
}
