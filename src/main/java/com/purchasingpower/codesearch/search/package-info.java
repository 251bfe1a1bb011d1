/**
 * Search engine: ranked symbol search and block similarity.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code SearchService} - Keyword relevance ranking over symbols</li>
 *   <li>{@code PatternSearchService} - Token-set similarity over code blocks</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.codesearch.search;
