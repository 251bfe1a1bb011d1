package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DefinitionMatch {

    String symbol;
    SymbolKind kind;
    String filePath;
    int lineNumber;
    String definition;
    String docstring;

    public static DefinitionMatch of(Symbol symbol) {
        return DefinitionMatch.builder()
            .symbol(symbol.getName())
            .kind(symbol.getKind())
            .filePath(symbol.getFilePath())
            .lineNumber(symbol.getLineNumber())
            .definition(symbol.getDefinition())
            .docstring(symbol.getDocstring())
            .build();
    }
}
