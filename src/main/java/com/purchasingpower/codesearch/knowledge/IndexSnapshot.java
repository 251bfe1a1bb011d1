package com.purchasingpower.codesearch.knowledge;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.purchasingpower.codesearch.core.RankedSymbol;
import com.purchasingpower.codesearch.graph.DependencyGraph;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * One immutable generation of the index: the symbols, the dependency graph
 * built from them and the search cache that belongs to them.
 *
 * <p>Queries read the current snapshot once and work on it alone. The search
 * cache is discarded together with its snapshot, so cached rankings never
 * outlive the data they were computed from.
 *
 * @since 1.0.0
 */
@Getter
public final class IndexSnapshot {

    /**
     * Search cache key. The scope is normalized, empty for the whole index.
     */
    public record SearchKey(String query, String scope) {
    }

    private static final IndexSnapshot EMPTY =
        new IndexSnapshot(null, 0L, SymbolIndex.empty(), DependencyGraph.empty(), null, 1L);

    private final Path root;
    private final long generation;
    private final SymbolIndex index;
    private final DependencyGraph graph;
    private final Instant builtAt;

    /**
     * Bounded LRU cache of ranked search hits for this generation.
     */
    private final Cache<SearchKey, List<RankedSymbol>> searchCache;

    public IndexSnapshot(Path root, long generation, SymbolIndex index, DependencyGraph graph,
                         Instant builtAt, long searchCacheMaxEntries) {
        this.root = root;
        this.generation = generation;
        this.index = index;
        this.graph = graph;
        this.builtAt = builtAt;
        this.searchCache = Caffeine.newBuilder()
            .maximumSize(searchCacheMaxEntries)
            .build();
    }

    public static IndexSnapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return root == null;
    }
}
