package com.purchasingpower.codesearch.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body for rejected requests.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private boolean success;
    private String error;

    public static ErrorResponse error(String error) {
        return ErrorResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
