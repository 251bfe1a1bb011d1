package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import com.purchasingpower.codesearch.knowledge.SymbolIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.purchasingpower.codesearch.graph.GraphFixtures.file;
import static com.purchasingpower.codesearch.graph.GraphFixtures.function;
import static com.purchasingpower.codesearch.graph.GraphFixtures.index;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Symbol Navigator Tests")
class SymbolNavigatorTest {

    private final SymbolNavigator navigator = new SymbolNavigator();

    private final IndexSnapshot snapshot = snapshot(index(
        file("lib/one.py", function("lib/one.py", "helper", 3)),
        file("lib/two.py", function("lib/two.py", "helper", 7)),
        file("app.py", function("app.py", "run", 2, "helper"), function("app.py", "main", 9, "run", "helper"))));

    private static IndexSnapshot snapshot(SymbolIndex index) {
        return new IndexSnapshot(Path.of("/repo"), 1L, index, new DependencyGraphBuilder().build(index),
            Instant.now(), 16);
    }

    @Test
    @DisplayName("Should list every definition with the name in index order")
    void findDefinition_ShouldReturnAllMatches() {
        List<DefinitionMatch> matches = navigator.findDefinition(snapshot, "helper");

        assertThat(matches).extracting(DefinitionMatch::getFilePath).containsExactly("lib/one.py", "lib/two.py");
        assertThat(matches).extracting(DefinitionMatch::getLineNumber).containsExactly(3, 7);
        assertThat(navigator.findDefinition(snapshot, "missing")).isEmpty();
    }

    @Test
    @DisplayName("Should list the callers of the first definition")
    void findReferences_ShouldReturnCallers() {
        Optional<List<SymbolReference>> references = navigator.findReferences(snapshot, "helper");

        assertThat(references).isPresent();
        assertThat(references.get())
            .extracting(SymbolReference::getFilePath, SymbolReference::getSymbol, SymbolReference::getLineNumber)
            .containsExactly(
                tuple("app.py", "run", 2),
                tuple("app.py", "main", 9));
        assertThat(references.get()).allMatch(reference -> "usage".equals(reference.getReferenceType()));
    }

    @Test
    @DisplayName("Should distinguish an unknown symbol from one without callers")
    void findReferences_ShouldSeparateUnknownFromUnused() {
        assertThat(navigator.findReferences(snapshot, "missing")).isEmpty();
        assertThat(navigator.findReferences(snapshot, "main")).contains(List.of());
    }
}
