/**
 * REST API layer: controllers and DTOs.
 *
 * <p>Exposes the engine under {@code /api/code-search}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codesearch.api;
