package com.purchasingpower.codesearch.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dependency graph of one index generation.
 *
 * <p>Nodes are ordered by the index position of their first symbol. The graph
 * also remembers which key each bare name resolves to: the first function or
 * class with that name in index order.
 *
 * @since 1.0.0
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = new DependencyGraph(new LinkedHashMap<>(), Map.of());

    private final Map<String, DependencyNode> nodes;
    private final Map<String, String> firstKeyByName;

    DependencyGraph(LinkedHashMap<String, DependencyNode> nodes, Map<String, String> firstKeyByName) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.firstKeyByName = Collections.unmodifiableMap(firstKeyByName);
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    public Optional<DependencyNode> node(String key) {
        return Optional.ofNullable(nodes.get(key));
    }

    /**
     * Node the bare {@code name} resolves to.
     */
    public Optional<DependencyNode> firstNodeNamed(String name) {
        return Optional.ofNullable(firstKeyByName.get(name)).map(nodes::get);
    }

    public Collection<DependencyNode> nodes() {
        return nodes.values();
    }

    public boolean contains(String key) {
        return nodes.containsKey(key);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return nodes.values().stream().mapToInt(node -> node.dependsOnMutable().size()).sum();
    }

    /**
     * Deep copy of the node table, for deriving the next generation.
     */
    LinkedHashMap<String, DependencyNode> copyNodes() {
        LinkedHashMap<String, DependencyNode> copy = new LinkedHashMap<>();
        nodes.forEach((key, node) -> copy.put(key, node.copy()));
        return copy;
    }
}
