package com.purchasingpower.codesearch.knowledge.extract;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import com.purchasingpower.codesearch.knowledge.ExtractedFile;
import com.purchasingpower.codesearch.knowledge.LanguageExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for line oriented, regular expression based extractors.
 *
 * <p>Each line is matched against every {@link Rule}; every match produces one
 * symbol named by the rule's capture group. Call dependencies are not extracted,
 * and dynamic or aliased declarations are missed.
 *
 * <p>Subclasses may override {@link #matchLine} to consume multi-line constructs
 * such as grouped imports.
 */
@Slf4j
public abstract class PatternExtractor implements LanguageExtractor {

    protected record Rule(Pattern pattern, SymbolKind kind) {

        static Rule of(String regex, SymbolKind kind) {
            return new Rule(Pattern.compile(regex), kind);
        }
    }

    protected abstract List<Rule> rules();

    /**
     * Documentation attached to the declaration on {@code lines[index]}, or {@code null}.
     */
    protected abstract String docstringAbove(String[] lines, int index);

    @Override
    public ExtractedFile extract(String filePath, String content) {
        String[] lines = SourceText.lines(content);
        List<Symbol> symbols = new ArrayList<>();

        int index = 0;
        while (index < lines.length) {
            index = matchLine(filePath, lines, index, symbols);
        }

        log.debug("Extracted {} {} symbols from {}", symbols.size(), language(), filePath);
        return ExtractedFile.builder().symbols(symbols).build();
    }

    /**
     * Match {@code lines[index]} and append the symbols found.
     *
     * @return index of the next line to examine
     */
    protected int matchLine(String filePath, String[] lines, int index, List<Symbol> out) {
        String line = lines[index];
        for (Rule rule : rules()) {
            Matcher matcher = rule.pattern().matcher(line);
            while (matcher.find()) {
                out.add(symbol(filePath, rule.kind(), matcher.group(1), index, line,
                    rule.kind() == SymbolKind.IMPORT ? null : docstringAbove(lines, index)));
            }
        }
        return index + 1;
    }

    protected Symbol symbol(String filePath, SymbolKind kind, String name, int index,
                            String definition, String docstring) {
        return Symbol.builder()
            .name(name)
            .kind(kind)
            .filePath(filePath)
            .lineNumber(index + 1)
            .definition(SourceText.collapse(stripOpeningBrace(definition)))
            .docstring(docstring)
            .dependencies(Collections.emptyList())
            .build();
    }

    /**
     * Text of the {@code /** ... *}{@code /} block ending on the line right above {@code index}.
     */
    protected static String blockCommentAbove(String[] lines, int index) {
        int end = index - 1;
        if (end < 0 || !lines[end].strip().endsWith("*/")) {
            return null;
        }
        int start = end;
        while (start >= 0 && !lines[start].strip().startsWith("/**")) {
            if (start < end && lines[start].contains("*/")) {
                return null;
            }
            start--;
        }
        if (start < 0) {
            return null;
        }

        List<String> text = new ArrayList<>();
        for (int i = start; i <= end; i++) {
            String cleaned = lines[i].strip();
            if (i == start) {
                cleaned = cleaned.substring(3);
            }
            if (cleaned.endsWith("*/")) {
                cleaned = cleaned.substring(0, cleaned.length() - 2);
            }
            cleaned = cleaned.strip();
            if (cleaned.startsWith("*")) {
                cleaned = cleaned.substring(1).strip();
            }
            text.add(cleaned);
        }
        return joinDocLines(text);
    }

    /**
     * Consecutive comment lines starting with {@code prefix} right above {@code index}.
     * Lines starting with {@code skipPrefix}, such as attributes, may sit between the
     * comment and the declaration.
     */
    protected static String lineCommentsAbove(String[] lines, int index, String prefix, String skipPrefix) {
        int i = index - 1;
        while (skipPrefix != null && i >= 0 && lines[i].strip().startsWith(skipPrefix)) {
            i--;
        }
        List<String> text = new ArrayList<>();
        while (i >= 0 && lines[i].strip().startsWith(prefix)) {
            text.add(0, lines[i].strip().substring(prefix.length()).strip());
            i--;
        }
        return joinDocLines(text);
    }

    private static String joinDocLines(List<String> text) {
        while (!text.isEmpty() && text.get(0).isEmpty()) {
            text.remove(0);
        }
        while (!text.isEmpty() && text.get(text.size() - 1).isEmpty()) {
            text.remove(text.size() - 1);
        }
        return text.isEmpty() ? null : String.join("\n", text);
    }

    private static String stripOpeningBrace(String line) {
        String trimmed = line.strip();
        return trimmed.endsWith("{") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
