package com.purchasingpower.codesearch.core;

/**
 * How a search result matched the query.
 */
public enum MatchType {
    EXACT,
    SEMANTIC,
    PATTERN,
    FUZZY
}
