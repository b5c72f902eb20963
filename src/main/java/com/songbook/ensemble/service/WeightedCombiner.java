package com.songbook.ensemble.service;

import com.songbook.ensemble.model.NormalizedContribution;
import com.songbook.ensemble.model.SourceResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class WeightedCombiner {

    public List<NormalizedContribution> combine(SourceResult normalized, double weight) {
        if (!normalized.isNormalized()) {
            throw new IllegalStateException("Source " + normalized.sourceName() + " has not been normalized");
        }

        List<NormalizedContribution> contributions = new ArrayList<>(normalized.candidates().size());
        for (int i = 0; i < normalized.candidates().size(); i++) {
            double score = normalized.normalizedScores().get(i);
            contributions.add(new NormalizedContribution(
                normalized.sourceName(),
                normalized.candidates().get(i),
                score,
                score * weight
            ));
        }
        return contributions;
    }
}
