package com.purchasingpower.codesearch.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Dependencies of one graph node in both directions.
 *
 * <p>The direct lists hold adjacent node keys. The transitive lists hold every key
 * reachable over the same edge direction, in breadth-first order, the origin excluded.
 */
@Value
@Builder
public class DependencyAnalysis {

    String symbol;
    String key;
    String filePath;
    List<String> dependsOn;
    List<String> dependedBy;
    int dependencyCount;
    int dependentCount;
    List<String> transitiveDependencies;
    List<String> transitiveDependents;
    List<String> unresolvedCalls;
    boolean external;
}
