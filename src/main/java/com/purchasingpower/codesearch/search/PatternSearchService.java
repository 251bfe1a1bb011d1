package com.purchasingpower.codesearch.search;

import com.purchasingpower.codesearch.knowledge.IndexSnapshot;

import java.util.List;

/**
 * Finds function and class blocks whose token set resembles a code snippet.
 */
public interface PatternSearchService {

    /**
     * @param language   language name or alias restricting candidate files; blank for all
     * @param threshold  minimum Jaccard similarity, within [0, 1]
     * @param maxResults results to return; the configured default when not positive
     * @throws IllegalArgumentException for a threshold outside [0, 1] or an unknown language
     */
    List<PatternMatch> findSimilar(IndexSnapshot snapshot, String snippet, String language,
                                   double threshold, int maxResults);
}
