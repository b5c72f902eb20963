package com.songbook.ensemble.exception;

import com.songbook.ensemble.model.SourceFailureKind;
import lombok.Getter;

/**
 * A single source failed to produce a usable result.
 */
@Getter
public abstract class SourceException extends RuntimeException {

    private final String sourceName;

    protected SourceException(String sourceName, String message, Throwable cause) {
        super("Source '" + sourceName + "': " + message, cause);
        this.sourceName = sourceName;
    }

    public abstract SourceFailureKind kind();
}
