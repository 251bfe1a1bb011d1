package com.purchasingpower.codesearch.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Code Normalizer Tests")
class CodeNormalizerTest {

    private final CodeNormalizer normalizer = new CodeNormalizer();

    @Test
    @DisplayName("Should strip comments per language family and collapse whitespace")
    void normalize_ShouldStripComments() {
        assertEquals("x = 1", normalizer.normalize("x  =  1   # set x\n", "python"));
        assertEquals("int x = 1;", normalizer.normalize("/* doc */ int x = 1; // trailing\n", "java"));
        assertEquals("x = 1 # kept", normalizer.normalize("x = 1 # kept", null));
    }

    @Test
    @DisplayName("Should split identifiers and single punctuation characters")
    void tokens_ShouldSplitWordsAndPunctuation() {
        assertThat(normalizer.tokens("def add(a, b): return a+b"))
            .containsExactly("def", "add", "(", "a", ",", "b", ")", ":", "return", "+");
    }

    @Test
    @DisplayName("Should compute Jaccard similarity")
    void similarity_ShouldBeJaccard() {
        assertEquals(0.5, normalizer.similarity(Set.of("a", "b", "c"), Set.of("b", "c", "d")), 1e-9);
        assertEquals(1.0, normalizer.similarity(Set.of("a"), Set.of("a")), 1e-9);
        assertEquals(0.0, normalizer.similarity(Set.of(), Set.of()), 1e-9);
    }
}
