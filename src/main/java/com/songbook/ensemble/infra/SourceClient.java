package com.songbook.ensemble.infra;

import com.songbook.ensemble.model.PlaylistRequest;
import com.songbook.ensemble.model.SourceConfig;
import com.songbook.ensemble.model.SourceResult;

import java.time.Duration;

public interface SourceClient {

    /**
     * Asks one source for up to {@code topK} candidates for the playlist.
     *
     * @throws com.songbook.ensemble.exception.SourceTimeoutException when no answer arrives within {@code timeout}
     * @throws com.songbook.ensemble.exception.SourceHttpException on a non-2xx status or a transport failure
     * @throws com.songbook.ensemble.exception.SourceSchemaException when the body cannot be read as candidates
     */
    SourceResult fetch(SourceConfig source, PlaylistRequest playlist, int topK, Duration timeout);
}
