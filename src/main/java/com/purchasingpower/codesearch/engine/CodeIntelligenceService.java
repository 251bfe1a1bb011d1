package com.purchasingpower.codesearch.engine;

import com.purchasingpower.codesearch.core.QueryOutcome;
import com.purchasingpower.codesearch.graph.DeadCodeFinding;
import com.purchasingpower.codesearch.graph.DefinitionMatch;
import com.purchasingpower.codesearch.graph.DependencyAnalysis;
import com.purchasingpower.codesearch.graph.ImpactAnalysisReport;
import com.purchasingpower.codesearch.graph.SymbolReference;
import com.purchasingpower.codesearch.knowledge.IndexingResult;
import com.purchasingpower.codesearch.search.PatternMatch;
import com.purchasingpower.codesearch.search.SearchPage;

import java.util.List;

/**
 * Entry point of the code search engine.
 *
 * <p>Every query reads the current index snapshot once and answers from it, so
 * a rebuild running at the same time is never observed half done. Before the
 * first successful {@link #indexCodebase} (or after {@link #clear}) every query
 * answers {@code INDEX_NOT_BUILT}. Unknown symbols answer {@code NOT_FOUND}.
 *
 * <p>File paths accepted by the queries may be relative to the indexed root or
 * absolute paths under it.
 *
 * @since 1.0.0
 */
public interface CodeIntelligenceService {

    /**
     * Index the tree at {@code rootPath}.
     *
     * @param extensions  extensions to include; configured defaults when null or empty
     * @param excludeDirs directory names to skip; configured defaults when null
     * @throws IllegalArgumentException when the root does not exist or is not a directory
     */
    IndexingResult indexCodebase(String rootPath, List<String> extensions, List<String> excludeDirs);

    QueryOutcome<SearchPage> semanticSearch(String query, String scope, int maxResults);

    /**
     * @param threshold minimum similarity; the configured default when null
     */
    QueryOutcome<List<PatternMatch>> findSimilarPatterns(String snippet, String language, Double threshold,
                                                          int maxResults);

    /**
     * @param filePath file of the symbol; when blank the first function or class with that name is used
     */
    QueryOutcome<DependencyAnalysis> analyzeDependencies(String symbol, String filePath);

    QueryOutcome<ImpactAnalysisReport> impactAnalysis(String symbol, String filePath);

    QueryOutcome<List<DeadCodeFinding>> detectDeadCode(String scope);

    QueryOutcome<List<DefinitionMatch>> findDefinition(String symbol);

    QueryOutcome<List<SymbolReference>> findReferences(String symbol);

    IndexStatus status();

    void clear();
}
