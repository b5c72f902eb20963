package com.songbook.ensemble.model;

import com.songbook.ensemble.exception.SourceException;

public record SourceFailure(
    String sourceName,
    SourceFailureKind kind,
    String message
) {
    public static SourceFailure from(SourceException exception) {
        return new SourceFailure(exception.getSourceName(), exception.kind(), exception.getMessage());
    }
}
