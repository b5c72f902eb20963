package com.songbook.ensemble.exception;

/**
 * The invocation was rejected before any source was called.
 */
public class EnsembleConfigurationException extends RuntimeException {

    public EnsembleConfigurationException(String message) {
        super(message);
    }
}
