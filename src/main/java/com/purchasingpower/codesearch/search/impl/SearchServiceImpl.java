package com.purchasingpower.codesearch.search.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.core.RankedSymbol;
import com.purchasingpower.codesearch.core.SearchResult;
import com.purchasingpower.codesearch.core.SourcePaths;
import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import com.purchasingpower.codesearch.search.RelevanceScorer;
import com.purchasingpower.codesearch.search.SearchPage;
import com.purchasingpower.codesearch.search.SearchService;
import com.purchasingpower.codesearch.search.SourceContextReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    private static final Comparator<RankedSymbol> RANKING =
        Comparator.comparingDouble(RankedSymbol::getScore).reversed()
            .thenComparing(ranked -> ranked.getSymbol().getFilePath())
            .thenComparingInt(ranked -> ranked.getSymbol().getLineNumber());

    private final RelevanceScorer relevanceScorer;
    private final SourceContextReader contextReader;
    private final CodeSearchProperties properties;

    @Override
    public SearchPage search(IndexSnapshot snapshot, String query, String scope, int maxResults) {
        if (query == null || query.isBlank()) {
            return SearchPage.empty(query);
        }
        int limit = maxResults > 0 ? maxResults : properties.getSearch().getDefaultMaxResults();
        String normalizedScope = SourcePaths.toRelative(snapshot.getRoot(), scope);

        IndexSnapshot.SearchKey key = new IndexSnapshot.SearchKey(
            query.strip().toLowerCase(Locale.ROOT), normalizedScope);
        Cache<IndexSnapshot.SearchKey, List<RankedSymbol>> cache = snapshot.getSearchCache();

        List<RankedSymbol> ranked = cache.getIfPresent(key);
        boolean cached = ranked != null;
        if (!cached) {
            ranked = rank(snapshot, query, normalizedScope);
            cache.put(key, ranked);
        }

        int contextLines = properties.getSearch().getContextLines();
        List<SearchResult> results = new ArrayList<>();
        for (RankedSymbol hit : ranked.subList(0, Math.min(limit, ranked.size()))) {
            results.add(toResult(snapshot, hit, contextLines));
        }

        log.debug("Search '{}' in '{}': {} hits, returning {} (cached={})",
            query, normalizedScope, ranked.size(), results.size(), cached);

        return SearchPage.builder()
            .query(query)
            .results(results)
            .totalFound(ranked.size())
            .cached(cached)
            .build();
    }

    private List<RankedSymbol> rank(IndexSnapshot snapshot, String query, String scope) {
        List<RankedSymbol> ranked = new ArrayList<>();
        for (Symbol symbol : snapshot.getIndex().allSymbols()) {
            if (SourcePaths.inScope(symbol.getFilePath(), scope)) {
                relevanceScorer.score(symbol, query).ifPresent(ranked::add);
            }
        }
        ranked.sort(RANKING);
        return List.copyOf(ranked);
    }

    private SearchResult toResult(IndexSnapshot snapshot, RankedSymbol hit, int contextLines) {
        Symbol symbol = hit.getSymbol();
        SourceContextReader.Context context =
            contextReader.read(snapshot.getRoot(), symbol.getFilePath(), symbol.getLineNumber(), contextLines);

        return SearchResult.builder()
            .filePath(symbol.getFilePath())
            .lineNumber(symbol.getLineNumber())
            .symbolName(symbol.getName())
            .matchedText(symbol.getDefinition())
            .contextBefore(context.before())
            .contextAfter(context.after())
            .relevanceScore(hit.getScore())
            .matchType(hit.getMatchType())
            .build();
    }
}
