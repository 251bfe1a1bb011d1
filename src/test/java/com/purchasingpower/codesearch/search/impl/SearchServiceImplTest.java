package com.purchasingpower.codesearch.search.impl;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.core.MatchType;
import com.purchasingpower.codesearch.core.SearchResult;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import com.purchasingpower.codesearch.knowledge.impl.IndexingServiceImpl;
import com.purchasingpower.codesearch.search.RelevanceScorer;
import com.purchasingpower.codesearch.search.SearchPage;
import com.purchasingpower.codesearch.search.SourceContextReader;
import com.purchasingpower.codesearch.testutil.SourceTree;
import com.purchasingpower.codesearch.testutil.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Search Service Tests")
class SearchServiceImplTest {

    @TempDir
    Path root;

    private CodeSearchProperties properties;
    private SearchServiceImpl searchService;
    private SourceTree tree;

    @BeforeEach
    void setUp() {
        properties = new CodeSearchProperties();
        properties.getSearch().setContextLines(1);
        searchService = new SearchServiceImpl(new RelevanceScorer(), new SourceContextReader(), properties);

        tree = SourceTree.at(root)
            .file("auth/login.py", """
                import hashlib


                def validate_token(token):
                    \"\"\"Check the session token.\"\"\"
                    return bool(token)


                def token():
                    return "t"
                """)
            .file("billing/invoice.py", """
                def render_invoice(invoice):
                    return str(invoice)


                def charge(card):
                    \"\"\"Charge using the stored token.\"\"\"
                    return card
                """);
    }

    private IndexSnapshot index() {
        IndexingServiceImpl indexing = TestEngine.indexingService(properties);
        assertTrue(indexing.index(root, List.of(".py"), List.of()).isSuccess());
        return indexing.current();
    }

    @Test
    @DisplayName("Should rank by score, then file, then line")
    void search_ShouldRankResults() {
        // Given
        IndexSnapshot snapshot = index();

        // When
        SearchPage page = searchService.search(snapshot, "token", null, 10);

        // Then
        assertThat(page.getResults())
            .extracting(SearchResult::getSymbolName)
            .containsExactly("validate_token", "token", "charge");
        assertThat(page.getResults())
            .extracting(SearchResult::getRelevanceScore)
            .containsExactly(1.0, 1.0, 0.4);
        assertEquals(MatchType.SEMANTIC, page.getResults().get(0).getMatchType());

        SearchResult exact = page.getResults().get(1);
        assertEquals(MatchType.EXACT, exact.getMatchType());
        assertEquals(1.0, exact.getRelevanceScore(), 1e-9);
        assertEquals("auth/login.py", exact.getFilePath());
        assertEquals(9, exact.getLineNumber());
        assertEquals("def token():", exact.getMatchedText());
        assertEquals(3, page.getTotalFound());
        assertFalse(page.isCached());
    }

    @Test
    @DisplayName("Should truncate to max results but report the total found")
    void search_ShouldTruncate() {
        SearchPage page = searchService.search(index(), "token", null, 1);

        assertThat(page.getResults()).hasSize(1);
        assertEquals(3, page.getTotalFound());
    }

    @Test
    @DisplayName("Should attach surrounding lines as context")
    void search_ShouldReadContext() {
        SearchResult hit = searchService.search(index(), "validate_token", null, 5).getResults().get(0);

        assertThat(hit.getContextBefore()).containsExactly("");
        assertThat(hit.getContextAfter()).containsExactly("    \"\"\"Check the session token.\"\"\"");
    }

    @Test
    @DisplayName("Should filter by scope directory")
    void search_ShouldHonourScope() {
        IndexSnapshot snapshot = index();

        assertThat(searchService.search(snapshot, "invoice", "billing", 10).getResults())
            .extracting(SearchResult::getSymbolName).containsExactly("render_invoice");
        assertThat(searchService.search(snapshot, "invoice", "auth/", 10).getResults()).isEmpty();
        assertThat(searchService.search(snapshot, "invoice", root.resolve("billing").toString(), 10).getResults())
            .hasSize(1);
    }

    @Test
    @DisplayName("Repeated queries should hit the cache but still read live context")
    void search_ShouldCacheRankingOnly() {
        // Given
        IndexSnapshot snapshot = index();
        SearchPage first = searchService.search(snapshot, "render_invoice", null, 5);
        assertFalse(first.isCached());
        assertThat(first.getResults().get(0).getContextAfter()).containsExactly("    return str(invoice)");

        // When
        tree.file("billing/invoice.py", "def render_invoice(invoice):\n    return repr(invoice)\n");
        SearchPage second = searchService.search(snapshot, "  Render_Invoice ", null, 5);

        // Then
        assertTrue(second.isCached());
        assertThat(second.getResults()).extracting(SearchResult::getSymbolName).containsExactly("render_invoice");
        assertThat(second.getResults().get(0).getContextAfter()).containsExactly("    return repr(invoice)");
    }

    @Test
    @DisplayName("Blank queries should return an empty page")
    void search_ShouldIgnoreBlankQuery() {
        SearchPage page = searchService.search(index(), "  ", null, 5);

        assertThat(page.getResults()).isEmpty();
        assertEquals(0, page.getTotalFound());
    }
}
