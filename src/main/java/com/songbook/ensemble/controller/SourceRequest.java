package com.songbook.ensemble.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record SourceRequest(
    @NotBlank String name,
    @NotBlank String endpoint,
    @PositiveOrZero Double weight
) {}
