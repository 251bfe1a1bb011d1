package com.purchasingpower.codesearch.knowledge.extract;

import java.util.regex.Pattern;

/**
 * Text helpers shared by the extractors.
 */
final class SourceText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private SourceText() {
    }

    static String collapse(String text) {
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }

    static String[] lines(String content) {
        return LINE_BREAK.split(content, -1);
    }
}
