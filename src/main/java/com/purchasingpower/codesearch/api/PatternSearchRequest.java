package com.purchasingpower.codesearch.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Similar pattern search request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternSearchRequest {

    @NotBlank(message = "code is required")
    private String code;

    private String language;
    private Double threshold;
    private Integer maxResults;
}
