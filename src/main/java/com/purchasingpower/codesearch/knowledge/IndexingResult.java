package com.purchasingpower.codesearch.knowledge;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one {@code index} call.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingResult {

    private boolean success;
    private String root;
    private int indexedFiles;
    private int totalSymbols;

    /**
     * Files (re-)extracted in this run.
     */
    private int extractedFiles;

    /**
     * Files reused from the previous generation because their fingerprint did not change.
     */
    private int unchangedFiles;

    private int removedFiles;

    /**
     * Files indexed with zero symbols because extraction failed.
     */
    private int failedFiles;

    private boolean incremental;
    private long generation;
    private long elapsedMs;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private String error;

    public static IndexingResult failure(String root, String error, List<String> warnings, long elapsedMs) {
        return IndexingResult.builder()
            .success(false)
            .root(root)
            .error(error)
            .warnings(warnings)
            .elapsedMs(elapsedMs)
            .build();
    }
}
