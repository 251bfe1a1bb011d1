package com.purchasingpower.codesearch.engine;

import com.purchasingpower.codesearch.knowledge.IndexState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the engine state for status reporting.
 */
@Value
@Builder
public class IndexStatus {
    IndexState state;
    long generation;
    String root;
    int fileCount;
    int symbolCount;
    int nodeCount;
    int edgeCount;
    Instant builtAt;
}
