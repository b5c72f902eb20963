package com.songbook.ensemble.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.songbook.ensemble.model.EnsembleResult;

import java.util.List;
import java.util.Map;

public record EnsembleResponse(
    List<RecommendationItem> recommendations,
    @JsonProperty("failed_sources") List<FailedSourceItem> failedSources,
    @JsonProperty("dropped_records") Map<String, Integer> droppedRecords
) {
    public static EnsembleResponse from(EnsembleResult result) {
        return new EnsembleResponse(
            result.items().stream().map(RecommendationItem::from).toList(),
            result.failures().stream().map(FailedSourceItem::from).toList(),
            result.droppedRecords()
        );
    }
}
