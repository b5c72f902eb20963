package com.songbook.ensemble.controller;

import java.util.List;

public record ExplanationResponse(
    String explanation,
    List<RecommendationItem> recommendations
) {}
