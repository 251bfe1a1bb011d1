package com.purchasingpower.codesearch.core;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A ranked semantic search hit.
 *
 * <p>The context lines are read from disk at query time, so they always reflect
 * the file as it currently is, even when the ranking itself came from the cache.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class SearchResult {

    String filePath;
    int lineNumber;

    /**
     * Definition text of the matched symbol.
     */
    String matchedText;

    List<String> contextBefore;

    List<String> contextAfter;

    /**
     * Relevance score (0.0 to 1.0).
     */
    double relevanceScore;

    MatchType matchType;

    /**
     * Name of the matched symbol.
     */
    String symbolName;
}
