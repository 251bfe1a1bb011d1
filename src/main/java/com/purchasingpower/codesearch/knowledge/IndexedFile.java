package com.purchasingpower.codesearch.knowledge;

import com.purchasingpower.codesearch.core.Symbol;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One file entry of the {@link SymbolIndex}.
 */
@Value
@Builder(toBuilder = true)
public class IndexedFile {

    String filePath;
    String contentHash;

    /**
     * Language family of the extractor used, {@code null} when no extractor handles the file.
     */
    String language;

    @Singular
    List<Symbol> symbols;

    @Singular
    List<String> topLevelCalls;

    /**
     * Whether extraction failed; such a file is indexed with no symbols.
     */
    boolean parseFailed;
}
