package com.purchasingpower.codesearch.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A named definition or import found in a source file.
 *
 * <p>File paths are relative to the indexed root and always use {@code /}
 * as separator. Line numbers are 1-based and point at the definition line.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Symbol {

    public static final String KEY_SEPARATOR = "::";

    String name;
    SymbolKind kind;
    String filePath;
    int lineNumber;

    /**
     * Signature or header text, whitespace collapsed.
     */
    String definition;

    /**
     * Documentation attached to the symbol, {@code null} when absent.
     */
    String docstring;

    /**
     * Names called from within the symbol's body, in first-seen order without duplicates.
     */
    @Singular
    List<String> dependencies;

    /**
     * Identity of the dependency graph node this symbol belongs to.
     */
    public String nodeKey() {
        return nodeKey(filePath, name);
    }

    public boolean isDefinition() {
        return kind != null && kind.isDefinition();
    }

    public static String nodeKey(String filePath, String name) {
        return filePath + KEY_SEPARATOR + name;
    }
}
