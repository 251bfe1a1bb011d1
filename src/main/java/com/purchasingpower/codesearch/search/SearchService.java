package com.purchasingpower.codesearch.search;

import com.purchasingpower.codesearch.knowledge.IndexSnapshot;

/**
 * Free-text search over the symbols of a snapshot.
 *
 * <p>Results are ranked by relevance score, then file path, then line. The ranking
 * for a (query, scope) pair is cached inside the snapshot, while the context lines
 * of the returned results are read from disk on every call.
 *
 * @since 1.0.0
 */
public interface SearchService {

    /**
     * @param scope      relative or absolute path prefix; blank for the whole index
     * @param maxResults results to return; the configured default when not positive
     */
    SearchPage search(IndexSnapshot snapshot, String query, String scope, int maxResults);
}
