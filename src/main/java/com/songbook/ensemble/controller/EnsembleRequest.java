package com.songbook.ensemble.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record EnsembleRequest(
    @NotEmpty @JsonProperty("playlist_ids") List<@NotNull Object> playlistIds,
    List<@Valid @NotNull SourceRequest> sources,
    @Positive @JsonProperty("top_k_per_source") Integer topKPerSource,
    @Positive @JsonProperty("top_k_final") Integer topKFinal,
    @Positive @JsonProperty("timeout_ms") Long timeoutMs,
    @JsonProperty("fail_fast") Boolean failFast
) {}
