package com.songbook.ensemble.model;

public enum SourceFailureKind {
    TIMEOUT,
    HTTP,
    SCHEMA
}
