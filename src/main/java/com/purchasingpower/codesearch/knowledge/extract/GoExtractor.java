package com.purchasingpower.codesearch.knowledge.extract;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go extractor: functions, methods, struct and interface types, single and
 * grouped imports. Preceding {@code //} lines form the docstring.
 */
@Component
public class GoExtractor extends PatternExtractor {

    private static final List<Rule> RULES = List.of(
        Rule.of("^func\\s+(?:\\([^)]*\\)\\s*)?([A-Za-z_]\\w*)\\s*[(\\[]", SymbolKind.FUNCTION),
        Rule.of("^type\\s+([A-Za-z_]\\w*)(?:\\[[^\\]]*\\])?\\s+(?:struct|interface)\\b", SymbolKind.CLASS),
        Rule.of("^import\\s+(?:[A-Za-z_.]\\w*\\s+)?\"([^\"]+)\"", SymbolKind.IMPORT));

    private static final Pattern IMPORT_GROUP = Pattern.compile("^import\\s*\\(\\s*$");
    private static final Pattern GROUPED_IMPORT = Pattern.compile("^\\s*(?:[A-Za-z_.]\\w*\\s+)?\"([^\"]+)\"");

    @Override
    public String language() {
        return "go";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".go");
    }

    @Override
    protected List<Rule> rules() {
        return RULES;
    }

    @Override
    protected String docstringAbove(String[] lines, int index) {
        return lineCommentsAbove(lines, index, "//", null);
    }

    @Override
    protected int matchLine(String filePath, String[] lines, int index, List<Symbol> out) {
        if (!IMPORT_GROUP.matcher(lines[index]).matches()) {
            return super.matchLine(filePath, lines, index, out);
        }
        int i = index + 1;
        while (i < lines.length && !lines[i].strip().startsWith(")")) {
            Matcher matcher = GROUPED_IMPORT.matcher(lines[i]);
            if (matcher.find()) {
                out.add(symbol(filePath, SymbolKind.IMPORT, matcher.group(1), i,
                    "import \"" + matcher.group(1) + "\"", null));
            }
            i++;
        }
        return i + 1;
    }
}
