package com.songbook.ensemble.model;

import java.util.List;

/**
 * Candidates returned by a single source, in the order the source ranked them.
 * {@code normalizedScores} is empty until the result has been normalized and is
 * otherwise aligned index by index with {@code candidates}.
 */
public record SourceResult(
    String sourceName,
    List<RawCandidate> candidates,
    double minRawScore,
    double maxRawScore,
    int droppedRecords,
    List<Double> normalizedScores
) {

    public SourceResult {
        candidates = List.copyOf(candidates);
        normalizedScores = normalizedScores == null ? List.of() : List.copyOf(normalizedScores);
        if (!normalizedScores.isEmpty() && normalizedScores.size() != candidates.size()) {
            throw new IllegalArgumentException("Expected " + candidates.size()
                + " normalized scores for source " + sourceName + ", got " + normalizedScores.size());
        }
    }

    public static SourceResult raw(String sourceName, List<RawCandidate> candidates, int droppedRecords) {
        double min = candidates.stream().mapToDouble(RawCandidate::rawScore).min().orElse(0.0);
        double max = candidates.stream().mapToDouble(RawCandidate::rawScore).max().orElse(0.0);
        return new SourceResult(sourceName, candidates, min, max, droppedRecords, List.of());
    }

    public SourceResult withNormalizedScores(List<Double> scores) {
        return new SourceResult(sourceName, candidates, minRawScore, maxRawScore, droppedRecords, scores);
    }

    public boolean isNormalized() {
        return candidates.isEmpty() || !normalizedScores.isEmpty();
    }
}
