package com.purchasingpower.codesearch.graph;

import java.util.List;
import java.util.Optional;

/**
 * Traversals over a {@link DependencyGraph}.
 *
 * <p>All traversals are breadth-first with a visited set, so they terminate on
 * cyclic graphs and visit each node at most once.
 */
public interface GraphTraversalService {

    /**
     * Keys the node calls directly.
     */
    List<String> findDirectDependencies(DependencyGraph graph, String key);

    /**
     * Keys calling the node directly.
     */
    List<String> findDirectDependents(DependencyGraph graph, String key);

    /**
     * Keys reachable over {@code dependsOn} edges within {@code maxDepth} hops, origin excluded.
     */
    List<String> findAllDependencies(DependencyGraph graph, String key, int maxDepth);

    /**
     * Keys reachable over {@code dependedBy} edges within {@code maxDepth} hops, origin excluded.
     */
    List<String> findAllDependents(DependencyGraph graph, String key, int maxDepth);

    /**
     * Direct and transitive dependencies of the node with {@code key} in both directions.
     *
     * @return empty when the graph has no such node
     */
    Optional<DependencyAnalysis> analyzeDependencies(DependencyGraph graph, String key);

    /**
     * Impact of changing the node with {@code key}.
     *
     * @return empty when the graph has no such node
     */
    Optional<ImpactAnalysisReport> analyzeImpact(DependencyGraph graph, String key);
}
