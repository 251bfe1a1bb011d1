package com.purchasingpower.codesearch.knowledge.extract;

import com.purchasingpower.codesearch.core.SymbolKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Rust extractor: functions, structs, enums, traits and {@code use} declarations.
 * Preceding {@code ///} lines form the docstring, attributes in between are skipped.
 */
@Component
public class RustExtractor extends PatternExtractor {

    private static final String VISIBILITY = "(?:pub(?:\\([^)]*\\))?\\s+)?";

    private static final List<Rule> RULES = List.of(
        Rule.of("^\\s*" + VISIBILITY + "(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?(?:extern\\s+\"[^\"]*\"\\s+)?"
            + "fn\\s+([A-Za-z_]\\w*)", SymbolKind.FUNCTION),
        Rule.of("^\\s*" + VISIBILITY + "(?:struct|enum|trait|union)\\s+([A-Za-z_]\\w*)", SymbolKind.CLASS),
        Rule.of("^\\s*" + VISIBILITY + "use\\s+([^;]+);", SymbolKind.IMPORT));

    @Override
    public String language() {
        return "rust";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".rs");
    }

    @Override
    protected List<Rule> rules() {
        return RULES;
    }

    @Override
    protected String docstringAbove(String[] lines, int index) {
        return lineCommentsAbove(lines, index, "///", "#[");
    }
}
