package com.songbook.ensemble.model;

import java.net.URI;

/**
 * One scoring source as declared by the caller. A {@code null} weight means
 * the caller left it unspecified.
 */
public record SourceConfig(
    String name,
    URI endpoint,
    Double weight
) {
    public static SourceConfig of(String name, String endpoint, Double weight) {
        return new SourceConfig(name, URI.create(endpoint), weight);
    }
}
