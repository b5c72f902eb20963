package com.songbook.ensemble.exception;

import com.songbook.ensemble.model.SourceFailureKind;
import lombok.Getter;

import java.time.Duration;

@Getter
public class SourceTimeoutException extends SourceException {

    private final Duration timeout;

    public SourceTimeoutException(String sourceName, Duration timeout) {
        super(sourceName, "no response within " + timeout.toMillis() + " ms", null);
        this.timeout = timeout;
    }

    @Override
    public SourceFailureKind kind() {
        return SourceFailureKind.TIMEOUT;
    }
}
