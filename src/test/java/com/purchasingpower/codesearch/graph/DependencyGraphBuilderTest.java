package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import com.purchasingpower.codesearch.knowledge.SymbolIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.purchasingpower.codesearch.graph.GraphFixtures.file;
import static com.purchasingpower.codesearch.graph.GraphFixtures.function;
import static com.purchasingpower.codesearch.graph.GraphFixtures.index;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Dependency Graph Builder Tests")
class DependencyGraphBuilderTest {

    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilder();
    }

    @Test
    @DisplayName("Should link callers and callees in both directions")
    void build_ShouldCreateSymmetricEdges() {
        // Given
        SymbolIndex index = index(
            file("a.py", function("a.py", "foo", 1)),
            file("b.py", function("b.py", "bar", 1, "foo", "print")),
            file("c.py", function("c.py", "baz", 1, "bar", "foo")));

        // When
        DependencyGraph graph = builder.build(index);

        // Then
        assertEquals(3, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        DependencyNode foo = graph.node("a.py::foo").orElseThrow();
        assertThat(foo.getDependedBy()).containsExactly("b.py::bar", "c.py::baz");
        assertThat(graph.node("c.py::baz").orElseThrow().getDependsOn()).containsExactly("b.py::bar", "a.py::foo");
        assertSymmetric(graph);
    }

    @Test
    @DisplayName("Should record unresolved calls and mark the node external")
    void build_ShouldRecordUnresolvedCalls() {
        // Given
        SymbolIndex index = index(file("b.py", function("b.py", "bar", 1, "print", "len")));

        // When
        DependencyNode bar = builder.build(index).node("b.py::bar").orElseThrow();

        // Then
        assertThat(bar.getDependsOn()).isEmpty();
        assertThat(bar.getUnresolvedCalls()).containsExactly("print", "len");
        assertTrue(bar.isExternal());
    }

    @Test
    @DisplayName("Should resolve a name to its first definition in index order")
    void build_ShouldUseFirstMatch() {
        // Given
        SymbolIndex index = index(
            file("lib/one.py", function("lib/one.py", "helper", 3)),
            file("lib/two.py", function("lib/two.py", "helper", 7)),
            file("main.py", function("main.py", "run", 1, "helper")));

        // When
        DependencyGraph graph = builder.build(index);

        // Then
        assertThat(graph.node("main.py::run").orElseThrow().getDependsOn()).containsExactly("lib/one.py::helper");
        assertThat(graph.node("lib/two.py::helper").orElseThrow().getDependedBy()).isEmpty();
        assertThat(graph.firstNodeNamed("helper")).map(DependencyNode::getKey).contains("lib/one.py::helper");
    }

    @Test
    @DisplayName("Should not create self edges for recursive functions")
    void build_ShouldDropSelfEdges() {
        // Given
        SymbolIndex index = index(file("fact.py", function("fact.py", "fact", 1, "fact")));

        // When
        DependencyNode fact = builder.build(index).node("fact.py::fact").orElseThrow();

        // Then
        assertThat(fact.getDependsOn()).isEmpty();
        assertThat(fact.getDependedBy()).isEmpty();
        assertThat(fact.getUnresolvedCalls()).isEmpty();
    }

    @Test
    @DisplayName("Should ignore imports when building nodes")
    void build_ShouldSkipImports() {
        // Given
        SymbolIndex index = index(file("a.py",
            function("a.py", "foo", 2),
            Symbol.builder()
                .name("os")
                .kind(SymbolKind.IMPORT)
                .filePath("a.py")
                .lineNumber(1)
                .definition("import os")
                .build()));

        // When
        DependencyGraph graph = builder.build(index);

        // Then
        assertThat(graph.nodes()).extracting(DependencyNode::getKey).containsExactly("a.py::foo");
    }

    @Test
    @DisplayName("Incremental rebuild should equal a full build of the new index")
    void rebuild_ShouldMatchFullBuild() {
        // Given
        SymbolIndex before = index(
            file("a.py", function("a.py", "foo", 1)),
            file("b.py", function("b.py", "bar", 1, "foo", "helper")),
            file("c.py", function("c.py", "baz", 1, "bar")),
            file("d.py", function("d.py", "helper", 1)));
        DependencyGraph previous = builder.build(before);

        // a.py now defines helper first, c.py stops calling bar, d.py is removed
        SymbolIndex after = index(
            file("a.py", function("a.py", "foo", 1), function("a.py", "helper", 4, "foo")),
            file("b.py", function("b.py", "bar", 1, "foo", "helper")),
            file("c.py", function("c.py", "baz", 1, "qux")),
            file("e.py", function("e.py", "qux", 1, "baz")));

        // When
        DependencyGraph incremental = builder.rebuild(previous, before, after, Set.of("a.py", "c.py", "d.py", "e.py"));
        DependencyGraph full = builder.build(after);

        // Then
        assertEquals(describe(full), describe(incremental));
        assertThat(incremental.node("b.py::bar").orElseThrow().getDependsOn())
            .containsExactly("a.py::foo", "a.py::helper");
        assertThat(incremental.node("a.py::foo").orElseThrow().getDependedBy())
            .containsExactly("a.py::helper", "b.py::bar");
        assertThat(incremental.contains("d.py::helper")).isFalse();
        assertSymmetric(incremental);

        // The previous generation is untouched
        assertThat(previous.node("b.py::bar").orElseThrow().getDependsOn())
            .containsExactly("a.py::foo", "d.py::helper");
    }

    @Test
    @DisplayName("Rebuild with no changed files should return the previous graph")
    void rebuild_ShouldReuseGraphWhenNothingChanged() {
        SymbolIndex index = index(file("a.py", function("a.py", "foo", 1)));
        DependencyGraph graph = builder.build(index);

        assertThat(builder.rebuild(graph, index, index, List.of())).isSameAs(graph);
    }

    private static void assertSymmetric(DependencyGraph graph) {
        for (DependencyNode node : graph.nodes()) {
            for (String target : node.getDependsOn()) {
                assertThat(graph.node(target).orElseThrow().getDependedBy()).contains(node.getKey());
            }
            for (String caller : node.getDependedBy()) {
                assertThat(graph.node(caller).orElseThrow().getDependsOn()).contains(node.getKey());
            }
        }
    }

    private static List<String> describe(DependencyGraph graph) {
        List<String> lines = new ArrayList<>();
        for (DependencyNode node : graph.nodes()) {
            lines.add(node.getKey() + " -> " + node.getDependsOn() + " <- " + node.getDependedBy()
                + " ? " + node.getUnresolvedCalls());
        }
        return lines;
    }
}
