/**
 * Call dependency graph, traversals and the analyses built on them.
 */
package com.purchasingpower.codesearch.graph;
