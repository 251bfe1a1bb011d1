package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.core.SourcePaths;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Exact-name navigation: go to definition and find references.
 */
@Component
public class SymbolNavigator {

    /**
     * Every symbol of any kind named {@code name}, in index order.
     */
    public List<DefinitionMatch> findDefinition(IndexSnapshot snapshot, String name) {
        return snapshot.getIndex().findByName(name).stream()
            .map(DefinitionMatch::of)
            .toList();
    }

    /**
     * Callers of the function or class {@code name} resolves to.
     *
     * @return empty when no function or class has that name
     */
    public Optional<List<SymbolReference>> findReferences(IndexSnapshot snapshot, String name) {
        DependencyGraph graph = snapshot.getGraph();
        return graph.firstNodeNamed(name)
            .map(node -> node.getDependedBy().stream()
                .map(callerKey -> toReference(graph, callerKey))
                .toList());
    }

    private SymbolReference toReference(DependencyGraph graph, String callerKey) {
        return SymbolReference.builder()
            .filePath(SourcePaths.fileOfKey(callerKey))
            .symbol(SourcePaths.nameOfKey(callerKey))
            .lineNumber(graph.node(callerKey).map(DependencyNode::getLineNumber).orElse(0))
            .build();
    }
}
