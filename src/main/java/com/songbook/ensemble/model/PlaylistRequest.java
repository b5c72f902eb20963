package com.songbook.ensemble.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered playlist identifiers (integers or strings). Duplicates are kept as sent.
 */
public record PlaylistRequest(List<Object> ids) {

    public PlaylistRequest {
        ids = ids == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(ids));
    }
}
