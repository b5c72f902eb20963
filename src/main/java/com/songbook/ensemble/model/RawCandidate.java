package com.songbook.ensemble.model;

public record RawCandidate(
    String canonicalKey,
    String title,
    String author,
    String description,
    double rawScore
) {}
