package com.songbook.ensemble.controller;

import com.songbook.ensemble.model.SourceFailure;

public record FailedSourceItem(
    String source,
    String error,
    String message
) {
    public static FailedSourceItem from(SourceFailure failure) {
        return new FailedSourceItem(failure.sourceName(), failure.kind().name(), failure.message());
    }
}
