package com.songbook.ensemble.model;

public enum EnsembleState {
    IDLE,
    DISPATCHING,
    COLLECTING,
    NORMALIZING,
    COMBINING,
    AGGREGATING,
    RANKING,
    DONE,
    FAILED
}
