package com.purchasingpower.codesearch.graph;

import lombok.Builder;
import lombok.Value;

/**
 * A place that refers to a symbol. Only call sites are tracked, so the
 * reference type is always {@code usage}.
 */
@Value
@Builder
public class SymbolReference {

    public static final String USAGE = "usage";

    String filePath;
    String symbol;
    int lineNumber;

    @Builder.Default
    String referenceType = USAGE;
}
