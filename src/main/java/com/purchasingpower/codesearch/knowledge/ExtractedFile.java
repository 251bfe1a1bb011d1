package com.purchasingpower.codesearch.knowledge;

import com.purchasingpower.codesearch.core.Symbol;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one extractor run over one file.
 */
@Value
@Builder
public class ExtractedFile {

    private static final ExtractedFile EMPTY = ExtractedFile.builder().build();

    @Singular
    List<Symbol> symbols;

    /**
     * Names called from module-level code that belongs to no function or class.
     */
    @Singular
    List<String> topLevelCalls;

    public static ExtractedFile empty() {
        return EMPTY;
    }
}
