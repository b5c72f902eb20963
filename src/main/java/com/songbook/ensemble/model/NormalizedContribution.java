package com.songbook.ensemble.model;

public record NormalizedContribution(
    String sourceName,
    RawCandidate candidate,
    double normalizedScore,
    double weightedScore
) {

    public String canonicalKey() {
        return candidate.canonicalKey();
    }
}
