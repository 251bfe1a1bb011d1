package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A function or class in the dependency graph, keyed by {@code filePath::name}.
 *
 * <p>Edge sets are only mutated by {@link DependencyGraphBuilder}, always in pairs:
 * {@code B} is in {@code A.dependsOn} exactly when {@code A} is in {@code B.dependedBy}.
 * Callers see read-only views.
 *
 * @since 1.0.0
 */
@Getter
public class DependencyNode {

    private final String key;
    private final String filePath;
    private final String name;
    private final SymbolKind kind;

    /**
     * Line of the first symbol with this key.
     */
    private final int lineNumber;

    @Getter(AccessLevel.NONE)
    private final Set<String> dependsOn = new LinkedHashSet<>();

    @Getter(AccessLevel.NONE)
    private final Set<String> dependedBy = new LinkedHashSet<>();

    @Getter(AccessLevel.NONE)
    private final Set<String> unresolvedCalls = new LinkedHashSet<>();

    DependencyNode(Symbol symbol) {
        this(symbol.nodeKey(), symbol.getFilePath(), symbol.getName(), symbol.getKind(), symbol.getLineNumber());
    }

    private DependencyNode(String key, String filePath, String name, SymbolKind kind, int lineNumber) {
        this.key = key;
        this.filePath = filePath;
        this.name = name;
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    /**
     * Keys this node calls.
     */
    public Set<String> getDependsOn() {
        return Collections.unmodifiableSet(dependsOn);
    }

    /**
     * Keys that call this node.
     */
    public Set<String> getDependedBy() {
        return Collections.unmodifiableSet(dependedBy);
    }

    /**
     * Called names that match no function or class in the index.
     */
    public Set<String> getUnresolvedCalls() {
        return Collections.unmodifiableSet(unresolvedCalls);
    }

    /**
     * Whether this node references code outside the index.
     */
    public boolean isExternal() {
        return !unresolvedCalls.isEmpty();
    }

    Set<String> dependsOnMutable() {
        return dependsOn;
    }

    Set<String> dependedByMutable() {
        return dependedBy;
    }

    Set<String> unresolvedMutable() {
        return unresolvedCalls;
    }

    DependencyNode copy() {
        DependencyNode copy = new DependencyNode(key, filePath, name, kind, lineNumber);
        copy.dependsOn.addAll(dependsOn);
        copy.dependedBy.addAll(dependedBy);
        copy.unresolvedCalls.addAll(unresolvedCalls);
        return copy;
    }

    @Override
    public String toString() {
        return "DependencyNode{" + key + ", dependsOn=" + dependsOn + ", dependedBy=" + dependedBy + "}";
    }
}
