package com.songbook.ensemble.exception;

import com.songbook.ensemble.model.SourceFailureKind;

import java.util.Optional;

public class SourceHttpException extends SourceException {

    private final Integer status;

    public SourceHttpException(String sourceName, int status, Throwable cause) {
        super(sourceName, "responded with HTTP " + status, cause);
        this.status = status;
    }

    private SourceHttpException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
        this.status = null;
    }

    public static SourceHttpException transport(String sourceName, Throwable cause) {
        return new SourceHttpException(sourceName, "request failed: " + cause.getMessage(), cause);
    }

    /**
     * Empty when the request failed before a response status was received.
     */
    public Optional<Integer> getStatus() {
        return Optional.ofNullable(status);
    }

    @Override
    public SourceFailureKind kind() {
        return SourceFailureKind.HTTP;
    }
}
