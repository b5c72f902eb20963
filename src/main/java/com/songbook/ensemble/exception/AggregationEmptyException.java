package com.songbook.ensemble.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class AggregationEmptyException extends RuntimeException {

    private final List<String> sourceNames;

    public AggregationEmptyException(List<String> sourceNames) {
        super("Sources " + sourceNames + " returned no usable candidates");
        this.sourceNames = List.copyOf(sourceNames);
    }
}
