package com.purchasingpower.codesearch.engine.impl;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.core.QueryOutcome;
import com.purchasingpower.codesearch.core.SourcePaths;
import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.engine.CodeIntelligenceService;
import com.purchasingpower.codesearch.engine.IndexStatus;
import com.purchasingpower.codesearch.graph.DeadCodeDetector;
import com.purchasingpower.codesearch.graph.DeadCodeFinding;
import com.purchasingpower.codesearch.graph.DefinitionMatch;
import com.purchasingpower.codesearch.graph.DependencyAnalysis;
import com.purchasingpower.codesearch.graph.DependencyNode;
import com.purchasingpower.codesearch.graph.GraphTraversalService;
import com.purchasingpower.codesearch.graph.ImpactAnalysisReport;
import com.purchasingpower.codesearch.graph.SymbolNavigator;
import com.purchasingpower.codesearch.graph.SymbolReference;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import com.purchasingpower.codesearch.knowledge.IndexingResult;
import com.purchasingpower.codesearch.knowledge.IndexingService;
import com.purchasingpower.codesearch.search.PatternMatch;
import com.purchasingpower.codesearch.search.PatternSearchService;
import com.purchasingpower.codesearch.search.SearchPage;
import com.purchasingpower.codesearch.search.SearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CodeIntelligenceServiceImpl implements CodeIntelligenceService {

    private final IndexingService indexingService;
    private final SearchService searchService;
    private final PatternSearchService patternSearchService;
    private final GraphTraversalService graphTraversalService;
    private final DeadCodeDetector deadCodeDetector;
    private final SymbolNavigator symbolNavigator;
    private final CodeSearchProperties properties;

    @Override
    public IndexingResult indexCodebase(String rootPath, List<String> extensions, List<String> excludeDirs) {
        if (rootPath == null || rootPath.isBlank()) {
            throw new IllegalArgumentException("Root path is required");
        }
        return indexingService.index(Paths.get(rootPath.trim()), extensions, excludeDirs);
    }

    @Override
    public QueryOutcome<SearchPage> semanticSearch(String query, String scope, int maxResults) {
        IndexSnapshot snapshot = indexingService.current();
        if (snapshot.isEmpty()) {
            return QueryOutcome.indexNotBuilt();
        }
        return QueryOutcome.ok(searchService.search(snapshot, query, scope, maxResults));
    }

    @Override
    public QueryOutcome<List<PatternMatch>> findSimilarPatterns(String snippet, String language, Double threshold,
                                                                 int maxResults) {
        IndexSnapshot snapshot = indexingService.current();
        if (snapshot.isEmpty()) {
            return QueryOutcome.indexNotBuilt();
        }
        double effectiveThreshold = threshold != null ? threshold : properties.getPattern().getThreshold();
        return QueryOutcome.ok(
            patternSearchService.findSimilar(snapshot, snippet, language, effectiveThreshold, maxResults));
    }

    @Override
    public QueryOutcome<DependencyAnalysis> analyzeDependencies(String symbol, String filePath) {
        IndexSnapshot snapshot = indexingService.current();
        if (snapshot.isEmpty()) {
            return QueryOutcome.indexNotBuilt();
        }
        return locate(snapshot, symbol, filePath)
            .flatMap(node -> graphTraversalService.analyzeDependencies(snapshot.getGraph(), node.getKey()))
            .map(QueryOutcome::ok)
            .orElseGet(() -> QueryOutcome.notFound(symbolNotFound(symbol, filePath)));
    }

    @Override
    public QueryOutcome<ImpactAnalysisReport> impactAnalysis(String symbol, String filePath) {
        IndexSnapshot snapshot = indexingService.current();
        if (snapshot.isEmpty()) {
            return QueryOutcome.indexNotBuilt();
        }
        return locate(snapshot, symbol, filePath)
            .flatMap(node -> graphTraversalService.analyzeImpact(snapshot.getGraph(), node.getKey()))
            .map(QueryOutcome::ok)
            .orElseGet(() -> QueryOutcome.notFound(symbolNotFound(symbol, filePath)));
    }

    @Override
    public QueryOutcome<List<DeadCodeFinding>> detectDeadCode(String scope) {
        IndexSnapshot snapshot = indexingService.current();
        if (snapshot.isEmpty()) {
            return QueryOutcome.indexNotBuilt();
        }
        String normalizedScope = SourcePaths.toRelative(snapshot.getRoot(), scope);
        return QueryOutcome.ok(deadCodeDetector.findDeadCode(snapshot, normalizedScope));
    }

    @Override
    public QueryOutcome<List<DefinitionMatch>> findDefinition(String symbol) {
        IndexSnapshot snapshot = indexingService.current();
        if (snapshot.isEmpty()) {
            return QueryOutcome.indexNotBuilt();
        }
        List<DefinitionMatch> matches = symbolNavigator.findDefinition(snapshot, symbol);
        return matches.isEmpty()
            ? QueryOutcome.notFound(symbolNotFound(symbol, null))
            : QueryOutcome.ok(matches);
    }

    @Override
    public QueryOutcome<List<SymbolReference>> findReferences(String symbol) {
        IndexSnapshot snapshot = indexingService.current();
        if (snapshot.isEmpty()) {
            return QueryOutcome.indexNotBuilt();
        }
        return symbolNavigator.findReferences(snapshot, symbol)
            .map(QueryOutcome::ok)
            .orElseGet(() -> QueryOutcome.notFound(symbolNotFound(symbol, null)));
    }

    @Override
    public IndexStatus status() {
        IndexSnapshot snapshot = indexingService.current();
        Path root = snapshot.getRoot();
        return IndexStatus.builder()
            .state(indexingService.state())
            .generation(snapshot.getGeneration())
            .root(root == null ? null : root.toString())
            .fileCount(snapshot.getIndex().fileCount())
            .symbolCount(snapshot.getIndex().symbolCount())
            .nodeCount(snapshot.getGraph().nodeCount())
            .edgeCount(snapshot.getGraph().edgeCount())
            .builtAt(snapshot.getBuiltAt())
            .build();
    }

    @Override
    public void clear() {
        indexingService.clear();
    }

    /**
     * Node for {@code symbol}: the exact {@code file::symbol} key when a file is given,
     * otherwise the first function or class with that name.
     */
    private Optional<DependencyNode> locate(IndexSnapshot snapshot, String symbol, String filePath) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String relative = SourcePaths.toRelative(snapshot.getRoot(), filePath);
        if (relative.isEmpty()) {
            return snapshot.getGraph().firstNodeNamed(symbol);
        }
        return snapshot.getGraph().node(Symbol.nodeKey(relative, symbol));
    }

    private static String symbolNotFound(String symbol, String filePath) {
        return filePath == null || filePath.isBlank()
            ? "Symbol not found: " + symbol
            : "Symbol not found: " + symbol + " in " + filePath;
    }
}
