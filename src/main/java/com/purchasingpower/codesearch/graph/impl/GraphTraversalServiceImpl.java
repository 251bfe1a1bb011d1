package com.purchasingpower.codesearch.graph.impl;

import com.purchasingpower.codesearch.core.SourcePaths;
import com.purchasingpower.codesearch.graph.DependencyAnalysis;
import com.purchasingpower.codesearch.graph.DependencyGraph;
import com.purchasingpower.codesearch.graph.DependencyNode;
import com.purchasingpower.codesearch.graph.GraphTraversalService;
import com.purchasingpower.codesearch.graph.ImpactAnalysisReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.function.Function;

@Slf4j
@Service
public class GraphTraversalServiceImpl implements GraphTraversalService {

    @Override
    public List<String> findDirectDependencies(DependencyGraph graph, String key) {
        return graph.node(key)
            .map(node -> List.copyOf(node.getDependsOn()))
            .orElse(List.of());
    }

    @Override
    public List<String> findDirectDependents(DependencyGraph graph, String key) {
        return graph.node(key)
            .map(node -> List.copyOf(node.getDependedBy()))
            .orElse(List.of());
    }

    @Override
    public List<String> findAllDependencies(DependencyGraph graph, String key, int maxDepth) {
        return new ArrayList<>(traverse(graph, key, maxDepth, DependencyNode::getDependsOn).keySet());
    }

    @Override
    public List<String> findAllDependents(DependencyGraph graph, String key, int maxDepth) {
        return new ArrayList<>(traverse(graph, key, maxDepth, DependencyNode::getDependedBy).keySet());
    }

    @Override
    public Optional<DependencyAnalysis> analyzeDependencies(DependencyGraph graph, String key) {
        Optional<DependencyNode> origin = graph.node(key);
        if (origin.isEmpty()) {
            log.debug("Dependency analysis requested for unknown node {}", key);
            return Optional.empty();
        }
        DependencyNode node = origin.get();

        List<String> dependsOn = findDirectDependencies(graph, key);
        List<String> dependedBy = findDirectDependents(graph, key);

        return Optional.of(DependencyAnalysis.builder()
            .symbol(node.getName())
            .key(key)
            .filePath(node.getFilePath())
            .dependsOn(dependsOn)
            .dependedBy(dependedBy)
            .dependencyCount(dependsOn.size())
            .dependentCount(dependedBy.size())
            .transitiveDependencies(findAllDependencies(graph, key, Integer.MAX_VALUE))
            .transitiveDependents(findAllDependents(graph, key, Integer.MAX_VALUE))
            .unresolvedCalls(List.copyOf(node.getUnresolvedCalls()))
            .external(node.isExternal())
            .build());
    }

    @Override
    public Optional<ImpactAnalysisReport> analyzeImpact(DependencyGraph graph, String key) {
        Optional<DependencyNode> origin = graph.node(key);
        if (origin.isEmpty()) {
            log.debug("Impact analysis requested for unknown node {}", key);
            return Optional.empty();
        }

        Map<String, Integer> depths = traverse(graph, key, Integer.MAX_VALUE, DependencyNode::getDependedBy);
        List<String> affected = new ArrayList<>(depths.keySet());

        Set<String> files = new LinkedHashSet<>();
        affected.forEach(affectedKey -> files.add(SourcePaths.fileOfKey(affectedKey)));

        int maxDepth = depths.values().stream().mapToInt(Integer::intValue).max().orElse(0);

        log.info("Impact of {}: {} symbols in {} files (depth {})", key, affected.size(), files.size(), maxDepth);

        return Optional.of(ImpactAnalysisReport.builder()
            .symbol(origin.get().getName())
            .analyzedNode(key)
            .affectedSymbols(affected)
            .affectedFiles(new ArrayList<>(files))
            .directDependents(List.copyOf(origin.get().getDependedBy()))
            .impactScore(affected.size())
            .maxDepth(maxDepth)
            .riskLevel(ImpactAnalysisReport.RiskLevel.of(affected.size()))
            .warning(affected.isEmpty()
                ? "No dependencies found"
                : "Changing this symbol will affect the listed symbols")
            .build());
    }

    /**
     * BFS from {@code startNode}; returns every reached key, origin excluded, with its depth
     * in visiting order.
     */
    private Map<String, Integer> traverse(DependencyGraph graph, String startNode, int maxDepth,
                                          Function<DependencyNode, Set<String>> neighbours) {
        Set<String> visited = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        Map<String, Integer> depths = new HashMap<>();

        visited.add(startNode);
        queue.add(startNode);
        depths.put(startNode, 0);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int currentDepth = depths.get(current);

            if (currentDepth >= maxDepth) continue;

            Optional<DependencyNode> node = graph.node(current);
            if (node.isEmpty()) continue;

            for (String neighbor : neighbours.apply(node.get())) {
                if (visited.add(neighbor)) {
                    queue.add(neighbor);
                    depths.put(neighbor, currentDepth + 1);
                }
            }
        }

        visited.remove(startNode);
        Map<String, Integer> reached = new LinkedHashMap<>();
        visited.forEach(key -> reached.put(key, depths.get(key)));
        return reached;
    }
}
