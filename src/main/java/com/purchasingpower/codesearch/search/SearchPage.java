package com.purchasingpower.codesearch.search;

import com.purchasingpower.codesearch.core.SearchResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of semantic search results.
 */
@Value
@Builder
public class SearchPage {

    String query;
    List<SearchResult> results;

    /**
     * Number of symbols that passed the score threshold, before truncation.
     */
    int totalFound;

    /**
     * Whether the ranking came from the snapshot's search cache.
     */
    boolean cached;

    public static SearchPage empty(String query) {
        return SearchPage.builder().query(query).results(List.of()).totalFound(0).cached(false).build();
    }
}
