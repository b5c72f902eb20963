package com.songbook.ensemble.infra;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body understood by every scoring source.
 */
public record ScoringRequest(
    @JsonProperty("playlist_ids") List<Object> playlistIds,
    @JsonProperty("top_k") int topK
) {}
