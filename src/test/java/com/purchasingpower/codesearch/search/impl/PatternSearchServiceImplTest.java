package com.purchasingpower.codesearch.search.impl;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import com.purchasingpower.codesearch.knowledge.impl.IndexingServiceImpl;
import com.purchasingpower.codesearch.search.CodeNormalizer;
import com.purchasingpower.codesearch.search.PatternMatch;
import com.purchasingpower.codesearch.testutil.SourceTree;
import com.purchasingpower.codesearch.testutil.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Pattern Search Service Tests")
class PatternSearchServiceImplTest {

    @TempDir
    Path root;

    private PatternSearchServiceImpl patternSearch;
    private IndexSnapshot snapshot;

    @BeforeEach
    void setUp() {
        CodeSearchProperties properties = new CodeSearchProperties();
        patternSearch = new PatternSearchServiceImpl(new CodeNormalizer(), TestEngine.registry(), properties);

        SourceTree.at(root)
            .file("math_utils.py", """
                def add(a, b):
                    # sum two values
                    return a + b


                class Calculator:
                    def total(self, items):
                        return sum(items)
                """)
            .file("web/math.js", """
                function add(a, b) {
                  return a + b;
                }

                function scale(v, k) {
                  const out = v.map(x => x * k);
                  return out;
                }
                """)
            .file("notes/readme.txt", "def add(a, b): return a + b\n");

        IndexingServiceImpl indexing = TestEngine.indexingService(properties);
        indexing.index(root, List.of(".py", ".js", ".txt"), List.of());
        snapshot = indexing.current();
    }

    @Test
    @DisplayName("Should find an identical Python block with similarity 1.0, ignoring comments")
    void findSimilar_ShouldMatchIdenticalBlock() {
        // When
        List<PatternMatch> matches = patternSearch.findSimilar(snapshot,
            "def add(a, b):\n    return a + b  # add them", "python", 0.9, 10);

        // Then
        assertThat(matches).hasSize(1);
        PatternMatch match = matches.get(0);
        assertEquals("math_utils.py", match.getFilePath());
        assertEquals(1, match.getLineNumber());
        assertEquals(1.0, match.getSimilarity(), 1e-9);
        assertEquals("python", match.getLanguage());
        assertThat(match.getCodeBlock()).startsWith("def add(a, b):").endsWith("return a + b");
    }

    @Test
    @DisplayName("Should cut Python blocks at the end of the indented body")
    void findSimilar_ShouldSplitPythonBlocks() {
        // When
        List<PatternMatch> matches = patternSearch.findSimilar(snapshot,
            "class Calculator:\n    def total(self, items):\n        return sum(items)", "py", 0.0, 10);

        // Then
        PatternMatch calculator = matches.get(0);
        assertEquals(6, calculator.getLineNumber());
        assertEquals(1.0, calculator.getSimilarity(), 1e-9);
        assertThat(calculator.getCodeBlock().split("\n")).hasSize(3);
        assertThat(matches).extracting(PatternMatch::getLineNumber).contains(1, 7);
    }

    @Test
    @DisplayName("Should restrict matches to the requested language family")
    void findSimilar_ShouldFilterByLanguage() {
        // When
        List<PatternMatch> matches = patternSearch.findSimilar(snapshot,
            "function add(a, b) {\n  return a + b;\n}", "typescript", 0.5, 10);

        // Then
        assertThat(matches).extracting(PatternMatch::getFilePath).containsOnly("web/math.js");
        PatternMatch best = matches.get(0);
        assertEquals(1, best.getLineNumber());
        assertEquals(1.0, best.getSimilarity(), 1e-9);
        assertThat(best.getCodeBlock().split("\n")).hasSize(3);
    }

    @Test
    @DisplayName("Should search every supported language when no language is given")
    void findSimilar_ShouldSearchAllLanguages() {
        List<PatternMatch> matches = patternSearch.findSimilar(snapshot, "add(a, b) return a + b", null, 0.3, 10);

        assertThat(matches).extracting(PatternMatch::getFilePath).contains("math_utils.py", "web/math.js")
            .doesNotContain("notes/readme.txt");
        assertThat(matches).isSortedAccordingTo((x, y) -> Double.compare(y.getSimilarity(), x.getSimilarity()));
    }

    @Test
    @DisplayName("Should strip snippet comments by each file's language when no language is given")
    void findSimilar_WithoutLanguage_ShouldIgnoreSnippetComments() {
        // Given
        String snippet = "def add(a, b):\n    # sum two values\n    return a + b  # add them";

        // When
        List<PatternMatch> matches = patternSearch.findSimilar(snapshot, snippet, null, 0.9, 10);

        // Then
        assertThat(matches).hasSize(1);
        assertEquals("math_utils.py", matches.get(0).getFilePath());
        assertEquals(1, matches.get(0).getLineNumber());
        assertEquals(1.0, matches.get(0).getSimilarity(), 1e-9);
    }

    @Test
    @DisplayName("Should apply the threshold and max results")
    void findSimilar_ShouldApplyLimits() {
        assertThat(patternSearch.findSimilar(snapshot, "while True: pass", "python", 0.7, 10)).isEmpty();
        assertThat(patternSearch.findSimilar(snapshot, "def add(a, b): return a + b", null, 0.0, 1)).hasSize(1);
        assertThat(patternSearch.findSimilar(snapshot, "   ", "python", 0.5, 10)).isEmpty();
    }

    @Test
    @DisplayName("Should reject unknown languages and thresholds outside [0, 1]")
    void findSimilar_ShouldValidateArguments() {
        assertThatThrownBy(() -> patternSearch.findSimilar(snapshot, "x", "cobol", 0.5, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cobol");
        assertThatThrownBy(() -> patternSearch.findSimilar(snapshot, "x", "python", 1.5, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> patternSearch.findSimilar(snapshot, "x", "python", -0.1, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
