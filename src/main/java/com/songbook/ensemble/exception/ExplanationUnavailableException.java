package com.songbook.ensemble.exception;

public class ExplanationUnavailableException extends RuntimeException {

    public ExplanationUnavailableException(String message) {
        super(message);
    }

    public ExplanationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
