package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.core.SymbolKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeadCodeFinding {
    String symbol;
    SymbolKind kind;
    String filePath;
    int lineNumber;
    String reason;
}
