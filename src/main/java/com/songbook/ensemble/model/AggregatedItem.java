package com.songbook.ensemble.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

public record AggregatedItem(
    String canonicalKey,
    String title,
    String author,
    String description,
    double finalScore,
    SortedSet<String> contributingSources
) {

    public AggregatedItem {
        if (contributingSources == null || contributingSources.isEmpty()) {
            throw new IllegalArgumentException("Item " + canonicalKey + " has no contributing source");
        }
        if (!Double.isFinite(finalScore) || finalScore < 0) {
            throw new IllegalArgumentException("Final score for item " + canonicalKey + " must be finite and non-negative, got " + finalScore);
        }
        contributingSources = Collections.unmodifiableSortedSet(new TreeSet<>(contributingSources));
    }
}
