package com.purchasingpower.codesearch.core;

/**
 * Kinds of symbols produced by language extractors.
 */
public enum SymbolKind {

    /**
     * Function, method or arrow function bound to a name.
     */
    FUNCTION,

    /**
     * Class, interface, enum, record, struct or trait.
     */
    CLASS,

    /**
     * An import statement. Never a dependency graph node.
     */
    IMPORT;

    /**
     * Whether symbols of this kind become dependency graph nodes.
     */
    public boolean isDefinition() {
        return this != IMPORT;
    }
}
