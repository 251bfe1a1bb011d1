package com.purchasingpower.codesearch.knowledge.extract;

import com.purchasingpower.codesearch.core.SymbolKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * JavaScript and TypeScript extractor.
 *
 * <p>Recognizes function declarations, arrow functions bound with
 * {@code const}/{@code let}/{@code var}, classes, ES module imports and
 * CommonJS {@code require} calls. A JSDoc block directly above a declaration
 * becomes its docstring.
 */
@Component
public class JsTsExtractor extends PatternExtractor {

    private static final String IDENT = "([A-Za-z_$][\\w$]*)";

    private static final List<Rule> RULES = List.of(
        Rule.of("(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?\\bfunction\\s*\\*?\\s*" + IDENT + "\\s*[(<]",
            SymbolKind.FUNCTION),
        Rule.of("(?:export\\s+)?\\b(?:const|let|var)\\s+" + IDENT
                + "\\s*(?::[^=]+)?=\\s*(?:async\\s*)?(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*(?::[^=]+)?=>",
            SymbolKind.FUNCTION),
        Rule.of("(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?\\bclass\\s+" + IDENT, SymbolKind.CLASS),
        Rule.of("^\\s*import\\s+.*?\\s+from\\s+['\"](.+?)['\"]", SymbolKind.IMPORT),
        Rule.of("\\brequire\\(\\s*['\"](.+?)['\"]\\s*\\)", SymbolKind.IMPORT));

    @Override
    public String language() {
        return "javascript";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".js", ".jsx", ".ts", ".tsx", ".mjs", ".cjs");
    }

    @Override
    protected List<Rule> rules() {
        return RULES;
    }

    @Override
    protected String docstringAbove(String[] lines, int index) {
        return blockCommentAbove(lines, index);
    }
}
