package com.purchasingpower.codesearch.api;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.core.QueryOutcome;
import com.purchasingpower.codesearch.engine.CodeIntelligenceService;
import com.purchasingpower.codesearch.engine.IndexStatus;
import com.purchasingpower.codesearch.graph.DeadCodeFinding;
import com.purchasingpower.codesearch.graph.DefinitionMatch;
import com.purchasingpower.codesearch.graph.DependencyAnalysis;
import com.purchasingpower.codesearch.graph.ImpactAnalysisReport;
import com.purchasingpower.codesearch.graph.SymbolReference;
import com.purchasingpower.codesearch.knowledge.IndexingResult;
import com.purchasingpower.codesearch.search.PatternMatch;
import com.purchasingpower.codesearch.search.SearchPage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the code search engine.
 *
 * <p>Query endpoints always answer 200 with a {@link QueryOutcome} body; a
 * missing index or an unknown symbol is reported through its status. Invalid
 * requests are answered with 400 by {@link ApiExceptionHandler}.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/code-search")
@RequiredArgsConstructor
public class CodeSearchController {

    private final CodeIntelligenceService codeIntelligenceService;
    private final CodeSearchProperties properties;

    /**
     * Index (or re-index) a codebase.
     *
     * POST /api/code-search/index
     */
    @PostMapping("/index")
    public ResponseEntity<IndexingResult> index(@Valid @RequestBody IndexRequest request) {
        log.info("Index request: {}", request.getRootPath());
        IndexingResult result = codeIntelligenceService.indexCodebase(
            request.getRootPath(), request.getExtensions(), request.getExcludeDirs());
        return ResponseEntity.ok(result);
    }

    /**
     * Drop the index.
     *
     * DELETE /api/code-search/index
     */
    @DeleteMapping("/index")
    public ResponseEntity<IndexStatus> clear() {
        codeIntelligenceService.clear();
        return ResponseEntity.ok(codeIntelligenceService.status());
    }

    /**
     * GET /api/code-search/status
     */
    @GetMapping("/status")
    public ResponseEntity<IndexStatus> status() {
        return ResponseEntity.ok(codeIntelligenceService.status());
    }

    /**
     * Ranked symbol search.
     *
     * POST /api/code-search/semantic
     */
    @PostMapping("/semantic")
    public ResponseEntity<QueryOutcome<SearchPage>> semanticSearch(
            @Valid @RequestBody SemanticSearchRequest request) {
        log.info("Semantic search: {}", request.getQuery());
        int maxResults = request.getMaxResults() != null
            ? request.getMaxResults()
            : properties.getSearch().getDefaultMaxResults();
        return ResponseEntity.ok(
            codeIntelligenceService.semanticSearch(request.getQuery(), request.getScope(), maxResults));
    }

    /**
     * Code blocks structurally similar to a snippet.
     *
     * POST /api/code-search/similar-patterns
     */
    @PostMapping("/similar-patterns")
    public ResponseEntity<QueryOutcome<List<PatternMatch>>> similarPatterns(
            @Valid @RequestBody PatternSearchRequest request) {
        log.info("Pattern search: language={}, threshold={}", request.getLanguage(), request.getThreshold());
        int maxResults = request.getMaxResults() != null
            ? request.getMaxResults()
            : properties.getPattern().getMaxResults();
        return ResponseEntity.ok(codeIntelligenceService.findSimilarPatterns(
            request.getCode(), request.getLanguage(), request.getThreshold(), maxResults));
    }

    /**
     * POST /api/code-search/dependencies
     */
    @PostMapping("/dependencies")
    public ResponseEntity<QueryOutcome<DependencyAnalysis>> dependencies(
            @Valid @RequestBody SymbolRequest request) {
        return ResponseEntity.ok(
            codeIntelligenceService.analyzeDependencies(request.getSymbol(), request.getFilePath()));
    }

    /**
     * POST /api/code-search/impact-analysis
     */
    @PostMapping("/impact-analysis")
    public ResponseEntity<QueryOutcome<ImpactAnalysisReport>> impactAnalysis(
            @Valid @RequestBody SymbolRequest request) {
        log.info("Impact analysis: {}", request.getSymbol());
        return ResponseEntity.ok(
            codeIntelligenceService.impactAnalysis(request.getSymbol(), request.getFilePath()));
    }

    /**
     * Impact analysis rendered as a Markdown report.
     *
     * POST /api/code-search/impact-analysis/report
     */
    @PostMapping(value = "/impact-analysis/report", produces = MediaType.TEXT_MARKDOWN_VALUE)
    public ResponseEntity<String> impactReport(@Valid @RequestBody SymbolRequest request) {
        log.info("Impact report: {}", request.getSymbol());
        QueryOutcome<ImpactAnalysisReport> outcome =
            codeIntelligenceService.impactAnalysis(request.getSymbol(), request.getFilePath());
        String body = outcome.isOk()
            ? outcome.getValue().toMarkdown()
            : "**" + outcome.getStatus() + "**: " + outcome.getMessage() + "\n";
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/code-search/dead-code
     */
    @PostMapping("/dead-code")
    public ResponseEntity<QueryOutcome<List<DeadCodeFinding>>> deadCode(
            @RequestBody(required = false) DeadCodeRequest request) {
        String scope = request != null ? request.getScope() : null;
        return ResponseEntity.ok(codeIntelligenceService.detectDeadCode(scope));
    }

    /**
     * POST /api/code-search/find-definition
     */
    @PostMapping("/find-definition")
    public ResponseEntity<QueryOutcome<List<DefinitionMatch>>> findDefinition(
            @Valid @RequestBody SymbolRequest request) {
        return ResponseEntity.ok(codeIntelligenceService.findDefinition(request.getSymbol()));
    }

    /**
     * POST /api/code-search/find-references
     */
    @PostMapping("/find-references")
    public ResponseEntity<QueryOutcome<List<SymbolReference>>> findReferences(
            @Valid @RequestBody SymbolRequest request) {
        return ResponseEntity.ok(codeIntelligenceService.findReferences(request.getSymbol()));
    }
}
