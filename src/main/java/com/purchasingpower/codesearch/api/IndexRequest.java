package com.purchasingpower.codesearch.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Index codebase request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRequest {

    @NotBlank(message = "rootPath is required")
    private String rootPath;

    private List<String> extensions;
    private List<String> excludeDirs;
}
