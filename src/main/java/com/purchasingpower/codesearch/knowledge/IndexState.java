package com.purchasingpower.codesearch.knowledge;

/**
 * Lifecycle of the engine's index.
 *
 * <pre>
 * EMPTY -> INDEXING -> READY -> INDEXING -> READY ...
 * </pre>
 * A failed or aborted rebuild returns to the state it started from.
 */
public enum IndexState {

    /**
     * No index has been built, or it was cleared.
     */
    EMPTY,

    /**
     * A rebuild is running. Queries keep using the previous snapshot.
     */
    INDEXING,

    READY
}
