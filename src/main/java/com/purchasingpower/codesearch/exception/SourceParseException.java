package com.purchasingpower.codesearch.exception;

import lombok.Getter;

/**
 * Thrown when a language extractor cannot parse a source file.
 *
 * <p>The indexer catches it per file, records a warning and indexes the file
 * with no symbols.
 */
@Getter
public class SourceParseException extends RuntimeException {

    private final String filePath;
    private final int line;

    public SourceParseException(String filePath, int line, String message) {
        super(filePath + ":" + line + ": " + message);
        this.filePath = filePath;
        this.line = line;
    }

    public SourceParseException(String filePath, String message, Throwable cause) {
        super(filePath + ": " + message, cause);
        this.filePath = filePath;
        this.line = 0;
    }
}
