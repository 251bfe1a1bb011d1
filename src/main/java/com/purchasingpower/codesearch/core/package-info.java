/**
 * Core value types shared by indexing, graph analysis and search.
 *
 * <p>All types here are immutable. Paths are relative to the indexed root.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codesearch.core;
