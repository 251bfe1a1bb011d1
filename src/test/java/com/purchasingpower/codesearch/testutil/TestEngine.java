package com.purchasingpower.codesearch.testutil;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.engine.CodeIntelligenceService;
import com.purchasingpower.codesearch.engine.impl.CodeIntelligenceServiceImpl;
import com.purchasingpower.codesearch.graph.DeadCodeDetector;
import com.purchasingpower.codesearch.graph.DependencyGraphBuilder;
import com.purchasingpower.codesearch.graph.SymbolNavigator;
import com.purchasingpower.codesearch.graph.impl.GraphTraversalServiceImpl;
import com.purchasingpower.codesearch.knowledge.LanguageRegistry;
import com.purchasingpower.codesearch.knowledge.extract.GoExtractor;
import com.purchasingpower.codesearch.knowledge.extract.JavaSourceExtractor;
import com.purchasingpower.codesearch.knowledge.extract.JsTsExtractor;
import com.purchasingpower.codesearch.knowledge.extract.PythonExtractor;
import com.purchasingpower.codesearch.knowledge.extract.RustExtractor;
import com.purchasingpower.codesearch.knowledge.impl.FileSystemScanner;
import com.purchasingpower.codesearch.knowledge.impl.IndexingServiceImpl;
import com.purchasingpower.codesearch.search.CodeNormalizer;
import com.purchasingpower.codesearch.search.RelevanceScorer;
import com.purchasingpower.codesearch.search.SourceContextReader;
import com.purchasingpower.codesearch.search.impl.PatternSearchServiceImpl;
import com.purchasingpower.codesearch.search.impl.SearchServiceImpl;

import java.util.List;

/**
 * Wires the engine by hand, extracting on the calling thread.
 */
public final class TestEngine {

    private TestEngine() {
    }

    public static LanguageRegistry registry() {
        return new LanguageRegistry(List.of(
            new PythonExtractor(),
            new JsTsExtractor(),
            new JavaSourceExtractor(),
            new GoExtractor(),
            new RustExtractor()));
    }

    public static IndexingServiceImpl indexingService(CodeSearchProperties properties) {
        return indexingService(properties, new DependencyGraphBuilder());
    }

    public static IndexingServiceImpl indexingService(CodeSearchProperties properties,
                                                      DependencyGraphBuilder graphBuilder) {
        return new IndexingServiceImpl(new FileSystemScanner(properties), registry(), graphBuilder,
            properties, Runnable::run);
    }

    public static CodeIntelligenceService engine(CodeSearchProperties properties) {
        return new CodeIntelligenceServiceImpl(
            indexingService(properties),
            new SearchServiceImpl(new RelevanceScorer(), new SourceContextReader(), properties),
            new PatternSearchServiceImpl(new CodeNormalizer(), registry(), properties),
            new GraphTraversalServiceImpl(),
            new DeadCodeDetector(properties),
            new SymbolNavigator(),
            properties);
    }

    public static CodeIntelligenceService engine() {
        return engine(new CodeSearchProperties());
    }
}
