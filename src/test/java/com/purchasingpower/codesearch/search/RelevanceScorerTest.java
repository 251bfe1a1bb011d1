package com.purchasingpower.codesearch.search;

import com.purchasingpower.codesearch.core.MatchType;
import com.purchasingpower.codesearch.core.RankedSymbol;
import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Relevance Scorer Tests")
class RelevanceScorerTest {

    private final RelevanceScorer scorer = new RelevanceScorer();

    private static Symbol symbol(String name, String definition, String docstring) {
        return Symbol.builder()
            .name(name)
            .kind(SymbolKind.FUNCTION)
            .filePath("a.py")
            .lineNumber(1)
            .definition(definition)
            .docstring(docstring)
            .build();
    }

    @Test
    @DisplayName("Exact name match should score 1.0 as EXACT")
    void score_ExactName() {
        RankedSymbol ranked = scorer.score(symbol("parse", "def parse(text):", null), "Parse").orElseThrow();

        assertEquals(1.0, ranked.getScore(), 1e-9);
        assertEquals(MatchType.EXACT, ranked.getMatchType());
    }

    @Test
    @DisplayName("Name containing the query should score 0.7 plus definition evidence")
    void score_Substring() {
        RankedSymbol ranked = scorer.score(symbol("parse_json", "def parse_json(raw):", null), "parse")
            .orElseThrow();

        // 0.7 for the name, 0.3 for the definition
        assertEquals(1.0, ranked.getScore(), 1e-9);
        assertEquals(MatchType.SEMANTIC, ranked.getMatchType());
    }

    @Test
    @DisplayName("Name containing one query word should score 0.5 as FUZZY")
    void score_WordMatch() {
        RankedSymbol ranked = scorer.score(symbol("load_user", "def load_user(uid):", null), "user profile")
            .orElseThrow();

        assertEquals(0.5, ranked.getScore(), 1e-9);
        assertEquals(MatchType.FUZZY, ranked.getMatchType());
    }

    @Test
    @DisplayName("Docstring evidence alone should be enough to rank a symbol")
    void score_DocstringOnly() {
        RankedSymbol ranked = scorer.score(symbol("handle", "def handle(req):", "Validates the token."), "token")
            .orElseThrow();

        assertThat(ranked.getScore()).isCloseTo(0.4, within(1e-9));
        assertEquals(MatchType.SEMANTIC, ranked.getMatchType());
    }

    @Test
    @DisplayName("Scores at or below the threshold should be dropped")
    void score_BelowThreshold() {
        // Definition evidence alone is exactly 0.3
        assertThat(scorer.score(symbol("run", "def run(config):", null), "config")).isEmpty();
        assertThat(scorer.score(symbol("run", "def run():", null), "unrelated")).isEmpty();
        assertThat(scorer.score(symbol("run", "def run():", null), "   ")).isEmpty();
    }

    @Test
    @DisplayName("Scores should always lie in (0.3, 1.0]")
    void score_ShouldBeBounded() {
        List<Symbol> symbols = List.of(
            symbol("cache", "def cache(cache_key):", "Cache helper for cache lookups."),
            symbol("cache_get", "def cache_get():", null),
            symbol("getter", "def getter():", "cache"),
            symbol("other", "def other():", null));

        for (Symbol candidate : symbols) {
            Optional<RankedSymbol> ranked = scorer.score(candidate, "cache");
            ranked.ifPresent(hit -> assertThat(hit.getScore()).isGreaterThan(0.3).isLessThanOrEqualTo(1.0));
        }
    }
}
