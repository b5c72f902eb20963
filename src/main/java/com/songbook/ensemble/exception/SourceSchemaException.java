package com.songbook.ensemble.exception;

import com.songbook.ensemble.model.SourceFailureKind;

public class SourceSchemaException extends SourceException {

    public SourceSchemaException(String sourceName, String message) {
        super(sourceName, message, null);
    }

    public SourceSchemaException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public SourceFailureKind kind() {
        return SourceFailureKind.SCHEMA;
    }
}
