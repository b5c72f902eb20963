package com.songbook.ensemble.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.songbook.ensemble.model.AggregatedItem;

import java.util.List;

public record RecommendationItem(
    String isbn,
    String title,
    String author,
    String description,
    @JsonProperty("score_final") double scoreFinal,
    @JsonProperty("models_contributing") List<String> modelsContributing
) {
    public static RecommendationItem from(AggregatedItem item) {
        return new RecommendationItem(
            item.canonicalKey(),
            item.title(),
            item.author(),
            item.description(),
            item.finalScore(),
            List.copyOf(item.contributingSources())
        );
    }
}
