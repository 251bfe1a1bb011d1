package com.purchasingpower.codesearch.knowledge;

import com.purchasingpower.codesearch.exception.SourceParseException;

import java.util.Set;

/**
 * Turns the content of one source file into symbols.
 *
 * <p>Implementations are stateless and safe to call from several extraction
 * threads at once.
 *
 * @since 1.0.0
 */
public interface LanguageExtractor {

    /**
     * Language family name, for example {@code python} or {@code javascript}.
     */
    String language();

    /**
     * File extensions handled, each with its leading dot.
     */
    Set<String> extensions();

    /**
     * Extract symbols from {@code content}.
     *
     * @param filePath path relative to the indexed root, stamped on every symbol
     * @param content  decoded file content
     * @throws SourceParseException when the content is malformed for this language
     */
    ExtractedFile extract(String filePath, String content);
}
