/**
 * Engine facade answering every query from one index snapshot.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codesearch.engine;
