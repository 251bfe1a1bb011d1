package com.purchasingpower.codesearch.knowledge;

import java.nio.file.Path;
import java.util.Collection;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Walks a source tree and produces the files to index.
 *
 * <p>Traversal is depth-first and pre-order: inside a directory the matching
 * files are emitted sorted by name, then the sub-directories are descended
 * sorted by name. Excluded directory names are pruned before descending and
 * symbolic links are never followed.
 *
 * <p>The scanner is stateless: every call re-walks the tree.
 *
 * @since 1.0.0
 */
public interface FileScanner {

    /**
     * Lazily scan {@code root}.
     *
     * @param root        directory to walk
     * @param extensions  extensions to include, with or without the leading dot
     * @param excludeDirs directory names to prune
     * @param warnings    receives one message per skipped file or directory
     * @return files in directory-scan order; the stream must be closed or fully consumed
     */
    Stream<ScannedFile> scan(Path root, Collection<String> extensions,
                             Collection<String> excludeDirs, Consumer<String> warnings);
}
