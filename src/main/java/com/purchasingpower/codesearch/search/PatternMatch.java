package com.purchasingpower.codesearch.search;

import lombok.Builder;
import lombok.Value;

/**
 * A code block similar to a query snippet.
 */
@Value
@Builder
public class PatternMatch {
    String filePath;
    int lineNumber;
    String codeBlock;
    double similarity;
    String language;
}
