package com.purchasingpower.codesearch.search;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes code for token-set similarity.
 *
 * <p>Comments are removed ({@code #} for Python, {@code //} and block comments
 * for the brace languages) and whitespace runs collapse to one space. Tokens are
 * identifier or number runs and single punctuation characters.
 */
@Component
public class CodeNormalizer {

    private static final Pattern HASH_COMMENT = Pattern.compile("#.*$", Pattern.MULTILINE);
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN = Pattern.compile("\\w+|[^\\w\\s]");

    /**
     * @param language language family, or {@code null} to keep comments
     */
    public String normalize(String code, String language) {
        String stripped = code;
        if ("python".equals(language)) {
            stripped = HASH_COMMENT.matcher(stripped).replaceAll("");
        } else if (language != null) {
            stripped = BLOCK_COMMENT.matcher(stripped).replaceAll("");
            stripped = LINE_COMMENT.matcher(stripped).replaceAll("");
        }
        return WHITESPACE.matcher(stripped).replaceAll(" ").strip();
    }

    public Set<String> tokens(String normalized) {
        Set<String> tokens = new LinkedHashSet<>();
        Matcher matcher = TOKEN.matcher(normalized);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Jaccard similarity of two token sets; 0 when both are empty.
     */
    public double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : a) {
            if (b.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }
}
