package com.purchasingpower.codesearch.core;

/**
 * Outcome category of a query against the index.
 */
public enum QueryStatus {

    OK,

    /**
     * The requested symbol or key does not exist in the current snapshot.
     */
    NOT_FOUND,

    /**
     * No index has been built yet, or it was cleared.
     */
    INDEX_NOT_BUILT
}
