package com.purchasingpower.codesearch.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * A source file produced by the scanner: its relative path, decoded content
 * and the SHA-256 fingerprint of its raw bytes.
 */
@Value
@Builder
public class ScannedFile {

    String relativePath;
    String content;
    String contentHash;

    /**
     * Extension including the leading dot, or an empty string.
     */
    public String extension() {
        int slash = relativePath.lastIndexOf('/');
        int dot = relativePath.lastIndexOf('.');
        return dot > slash ? relativePath.substring(dot) : "";
    }
}
