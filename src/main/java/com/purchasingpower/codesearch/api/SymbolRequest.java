package com.purchasingpower.codesearch.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request naming one symbol, optionally pinned to a file.
 *
 * Used by the dependency, impact, definition and reference endpoints. The
 * definition and reference lookups ignore {@code filePath}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    private String filePath;
}
