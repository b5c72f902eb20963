package com.songbook.ensemble.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked output of one invocation. {@code sourceResults} holds the normalized
 * results of the sources that answered and {@code failures} the ones that did
 * not, both in declared source order.
 */
public record EnsembleResult(
    List<AggregatedItem> items,
    List<SourceResult> sourceResults,
    List<SourceFailure> failures
) {

    public EnsembleResult {
        items = List.copyOf(items);
        sourceResults = List.copyOf(sourceResults);
        failures = List.copyOf(failures);
    }

    public Map<String, Integer> droppedRecords() {
        Map<String, Integer> dropped = new LinkedHashMap<>();
        sourceResults.forEach(result -> dropped.put(result.sourceName(), result.droppedRecords()));
        return dropped;
    }
}
