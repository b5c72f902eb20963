package com.songbook.ensemble.model;

import lombok.Builder;

import java.time.Duration;
import java.util.List;

/**
 * Inbound aggregation call. Nullable fields fall back to the {@code app.ensemble}
 * defaults; a {@code null} source list selects the configured sources.
 */
@Builder
public record EnsembleCommand(
    List<Object> playlistIds,
    List<SourceConfig> sources,
    Integer topKPerSource,
    Integer topKFinal,
    Duration timeoutPerSource,
    Boolean failFast
) {}
