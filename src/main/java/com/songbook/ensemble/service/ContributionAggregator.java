package com.songbook.ensemble.service;

import com.songbook.ensemble.model.AggregatedItem;
import com.songbook.ensemble.model.NormalizedContribution;
import com.songbook.ensemble.model.RawCandidate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Merges contributions that share a canonical key.
 * <p>
 * Scores are summed. Title, author and description come from the first contribution
 * seen for the key, so callers must pass contributions in declared source order for
 * the output to be reproducible.
 */
@Component
public class ContributionAggregator {

    public Map<String, AggregatedItem> aggregate(List<NormalizedContribution> contributions) {
        Map<String, Accumulator> groups = new LinkedHashMap<>();
        for (NormalizedContribution contribution : contributions) {
            groups.computeIfAbsent(contribution.canonicalKey(), key -> new Accumulator(contribution.candidate()))
                .add(contribution);
        }

        Map<String, AggregatedItem> aggregated = new LinkedHashMap<>();
        groups.forEach((key, group) -> aggregated.put(key, group.toItem()));
        return aggregated;
    }

    private static final class Accumulator {

        private final RawCandidate firstSeen;
        private final SortedSet<String> sources = new TreeSet<>();
        private double score;

        private Accumulator(RawCandidate firstSeen) {
            this.firstSeen = firstSeen;
        }

        private void add(NormalizedContribution contribution) {
            score += contribution.weightedScore();
            sources.add(contribution.sourceName());
        }

        private AggregatedItem toItem() {
            return new AggregatedItem(
                firstSeen.canonicalKey(),
                firstSeen.title(),
                firstSeen.author(),
                firstSeen.description(),
                score,
                sources
            );
        }
    }
}
