package com.songbook.ensemble.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
