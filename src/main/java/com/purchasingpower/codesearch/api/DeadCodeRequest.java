package com.purchasingpower.codesearch.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadCodeRequest {

    /**
     * Directory or file to inspect; the whole index when blank.
     */
    private String scope;
}
