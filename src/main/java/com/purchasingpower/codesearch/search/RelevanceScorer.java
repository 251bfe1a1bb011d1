package com.purchasingpower.codesearch.search;

import com.purchasingpower.codesearch.core.MatchType;
import com.purchasingpower.codesearch.core.RankedSymbol;
import com.purchasingpower.codesearch.core.Symbol;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Scores a symbol against a free-text query.
 *
 * <p>Name evidence (only the strongest applies): exact match 1.0, name contains
 * the query 0.7, name contains one of the query words 0.5. Docstring containing
 * the query adds 0.4, definition containing it adds 0.3. All comparisons ignore
 * case and the total is capped at 1.0. Symbols scoring 0.3 or less are dropped.
 */
@Component
public class RelevanceScorer {

    static final double MIN_SCORE = 0.3;

    public Optional<RankedSymbol> score(Symbol symbol, String query) {
        String queryLower = query.strip().toLowerCase(Locale.ROOT);
        if (queryLower.isEmpty()) {
            return Optional.empty();
        }
        String name = symbol.getName().toLowerCase(Locale.ROOT);

        double score = 0.0;
        MatchType matchType = MatchType.SEMANTIC;
        if (name.equals(queryLower)) {
            score += 1.0;
            matchType = MatchType.EXACT;
        } else if (name.contains(queryLower)) {
            score += 0.7;
        } else if (anyWordIn(name, queryLower)) {
            score += 0.5;
            matchType = MatchType.FUZZY;
        }

        if (containsIgnoreCase(symbol.getDocstring(), queryLower)) {
            score += 0.4;
        }
        if (containsIgnoreCase(symbol.getDefinition(), queryLower)) {
            score += 0.3;
        }

        score = Math.min(score, 1.0);
        return score > MIN_SCORE
            ? Optional.of(new RankedSymbol(symbol, score, matchType))
            : Optional.empty();
    }

    private static boolean anyWordIn(String name, String queryLower) {
        for (String word : queryLower.split("\\s+")) {
            if (!word.isEmpty() && name.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(String text, String queryLower) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(queryLower);
    }
}
