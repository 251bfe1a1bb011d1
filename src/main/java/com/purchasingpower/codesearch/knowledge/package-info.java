/**
 * Knowledge management: scanning, symbol extraction and the versioned index.
 *
 * <p>This package turns a source tree into immutable index generations:
 * <ul>
 *   <li>Scanning - deterministic walk of the tree with content fingerprints</li>
 *   <li>Extraction - per-language symbol extractors behind one registry</li>
 *   <li>Indexing - single-writer rebuilds published as {@code IndexSnapshot}s</li>
 * </ul>
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code FileScanner} - Source file discovery</li>
 *   <li>{@code LanguageRegistry} - Extension to extractor routing</li>
 *   <li>{@code SymbolIndex} - File to symbols mapping of one generation</li>
 *   <li>{@code IndexingService} - Full and incremental rebuilds</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.codesearch.knowledge;
