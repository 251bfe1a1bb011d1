package com.purchasingpower.codesearch.core;

import lombok.Value;

/**
 * A symbol with its relevance score for one query.
 */
@Value
public class RankedSymbol {
    Symbol symbol;
    double score;
    MatchType matchType;
}
