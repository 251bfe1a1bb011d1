package com.purchasingpower.codesearch.knowledge;

import java.nio.file.Path;
import java.util.List;

/**
 * Owns the index: runs rebuilds and publishes snapshots.
 *
 * <p>Rebuilds are serialized. Each one derives the next generation from the
 * current snapshot and swaps it in atomically, so readers never see a partial
 * index.
 *
 * @since 1.0.0
 */
public interface IndexingService {

    /**
     * Scan {@code root} and publish a new generation.
     *
     * <p>When {@code root} is the root of the current snapshot only files whose
     * fingerprint changed are re-extracted; otherwise the index is built from scratch.
     *
     * @param extensions  extensions to include, defaults when null or empty
     * @param excludeDirs directory names to prune, defaults when null
     * @throws IllegalArgumentException when {@code root} is not a directory
     */
    IndexingResult index(Path root, List<String> extensions, List<String> excludeDirs);

    /**
     * The current generation; {@link IndexSnapshot#empty()} before the first build.
     */
    IndexSnapshot current();

    IndexState state();

    /**
     * Drop the index and return to {@link IndexState#EMPTY}.
     */
    void clear();
}
