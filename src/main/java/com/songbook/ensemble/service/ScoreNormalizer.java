package com.songbook.ensemble.service;

import com.songbook.ensemble.model.RawCandidate;
import com.songbook.ensemble.model.SourceResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Min-max rescaling of one source's raw scores onto [0, 1]. Never looks at other sources.
 */
@Component
public class ScoreNormalizer {

    public SourceResult normalize(SourceResult result) {
        // Halved operands keep max - min finite for any pair of finite scores.
        double halfMin = result.minRawScore() / 2;
        double halfRange = result.maxRawScore() / 2 - halfMin;

        // All scores equal: no discriminating signal, every candidate keeps full weight.
        List<Double> normalized = result.candidates().stream()
            .map(RawCandidate::rawScore)
            .map(raw -> halfRange > 0 ? Math.min(1.0, Math.max(0.0, (raw / 2 - halfMin) / halfRange)) : 1.0)
            .toList();

        return result.withNormalizedScores(normalized);
    }
}
