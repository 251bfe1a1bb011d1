package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.knowledge.SymbolIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the dependency graph from a {@link SymbolIndex}.
 *
 * <p>Every call name of a function or class is resolved to the first function or
 * class with exactly that name in index order. Names that resolve nowhere are
 * recorded as unresolved calls of the caller; a call resolving to the caller
 * itself creates no edge.
 *
 * <p>{@link #rebuild} splices only the changed files into a copy of the previous
 * graph and produces the same graph, including ordering, as {@link #build}.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class DependencyGraphBuilder {

    /**
     * Full build.
     */
    public DependencyGraph build(SymbolIndex index) {
        Map<String, String> resolution = resolutionTable(index);
        LinkedHashMap<String, DependencyNode> nodes = new LinkedHashMap<>();
        for (Symbol symbol : index.allSymbols()) {
            if (symbol.isDefinition()) {
                nodes.computeIfAbsent(symbol.nodeKey(), key -> new DependencyNode(symbol));
            }
        }

        for (String key : new ArrayList<>(nodes.keySet())) {
            resolve(nodes, index, resolution, key);
        }

        DependencyGraph graph = finish(nodes, index, resolution);
        log.debug("Built dependency graph: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Incremental build.
     *
     * @param previous      graph of the previous generation
     * @param previousIndex index the previous graph was built from
     * @param index         index of the new generation
     * @param changedFiles  files re-extracted, added or removed since {@code previousIndex}
     */
    public DependencyGraph rebuild(DependencyGraph previous, SymbolIndex previousIndex,
                                   SymbolIndex index, Collection<String> changedFiles) {
        Set<String> changed = new HashSet<>(changedFiles);
        if (changed.isEmpty()) {
            return previous;
        }

        // Names whose resolution may differ between the two generations
        Set<String> touchedNames = new HashSet<>();
        for (String path : changed) {
            definitionNames(previousIndex.symbolsOf(path), touchedNames);
            definitionNames(index.symbolsOf(path), touchedNames);
        }

        LinkedHashMap<String, DependencyNode> nodes = previous.copyNodes();

        List<DependencyNode> stale = nodes.values().stream()
            .filter(node -> changed.contains(node.getFilePath()))
            .toList();
        for (DependencyNode node : stale) {
            detach(nodes, node);
            nodes.remove(node.getKey());
        }

        Set<String> affected = new LinkedHashSet<>();
        for (String path : changed) {
            for (Symbol symbol : index.symbolsOf(path)) {
                if (symbol.isDefinition()) {
                    nodes.computeIfAbsent(symbol.nodeKey(), key -> new DependencyNode(symbol));
                    affected.add(symbol.nodeKey());
                }
            }
        }
        for (Symbol symbol : index.allSymbols()) {
            if (symbol.isDefinition() && !changed.contains(symbol.getFilePath())
                && symbol.getDependencies().stream().anyMatch(touchedNames::contains)) {
                affected.add(symbol.nodeKey());
            }
        }

        Map<String, String> resolution = resolutionTable(index);
        for (String key : affected) {
            resolve(nodes, index, resolution, key);
        }

        DependencyGraph graph = finish(nodes, index, resolution);
        log.debug("Rebuilt dependency graph for {} changed files: {} nodes re-resolved, {} nodes total",
            changed.size(), affected.size(), graph.nodeCount());
        return graph;
    }

    /**
     * Bare name to the key of its first function or class in index order.
     */
    private static Map<String, String> resolutionTable(SymbolIndex index) {
        Map<String, String> resolution = new HashMap<>();
        for (Symbol symbol : index.allSymbols()) {
            if (symbol.isDefinition()) {
                resolution.putIfAbsent(symbol.getName(), symbol.nodeKey());
            }
        }
        return resolution;
    }

    /**
     * Recompute the outgoing edges of {@code key} from every symbol sharing that key.
     */
    private static void resolve(Map<String, DependencyNode> nodes, SymbolIndex index,
                                Map<String, String> resolution, String key) {
        DependencyNode node = nodes.get(key);
        clearOutgoing(nodes, node);

        for (Symbol symbol : index.symbolsOf(node.getFilePath())) {
            if (!symbol.isDefinition() || !symbol.getName().equals(node.getName())) {
                continue;
            }
            for (String call : symbol.getDependencies()) {
                String target = resolution.get(call);
                if (target == null) {
                    node.unresolvedMutable().add(call);
                } else if (!target.equals(key)) {
                    node.dependsOnMutable().add(target);
                    nodes.get(target).dependedByMutable().add(key);
                }
            }
        }
    }

    private static void clearOutgoing(Map<String, DependencyNode> nodes, DependencyNode node) {
        for (String target : node.dependsOnMutable()) {
            DependencyNode callee = nodes.get(target);
            if (callee != null) {
                callee.dependedByMutable().remove(node.getKey());
            }
        }
        node.dependsOnMutable().clear();
        node.unresolvedMutable().clear();
    }

    /**
     * Remove every edge touching {@code node}, on both sides.
     */
    private static void detach(Map<String, DependencyNode> nodes, DependencyNode node) {
        clearOutgoing(nodes, node);
        for (String caller : node.dependedByMutable()) {
            DependencyNode dependent = nodes.get(caller);
            if (dependent != null) {
                dependent.dependsOnMutable().remove(node.getKey());
            }
        }
        node.dependedByMutable().clear();
    }

    /**
     * Put nodes and incoming edges in index order so that full and incremental
     * builds of the same index are identical.
     */
    private static DependencyGraph finish(LinkedHashMap<String, DependencyNode> nodes, SymbolIndex index,
                                          Map<String, String> resolution) {
        Map<String, Integer> position = new HashMap<>();
        LinkedHashMap<String, DependencyNode> ordered = new LinkedHashMap<>();
        for (Symbol symbol : index.allSymbols()) {
            String key = symbol.nodeKey();
            if (symbol.isDefinition() && !ordered.containsKey(key)) {
                position.put(key, ordered.size());
                ordered.put(key, nodes.get(key));
            }
        }

        Comparator<String> byPosition = Comparator.comparingInt(key -> position.getOrDefault(key, Integer.MAX_VALUE));
        for (DependencyNode node : ordered.values()) {
            List<String> callers = new ArrayList<>(node.dependedByMutable());
            callers.sort(byPosition);
            node.dependedByMutable().clear();
            node.dependedByMutable().addAll(callers);
        }
        return new DependencyGraph(ordered, resolution);
    }

    private static void definitionNames(List<Symbol> symbols, Set<String> into) {
        for (Symbol symbol : symbols) {
            if (symbol.isDefinition()) {
                into.add(symbol.getName());
            }
        }
    }
}
