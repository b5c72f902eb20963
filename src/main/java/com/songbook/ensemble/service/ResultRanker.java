package com.songbook.ensemble.service;

import com.songbook.ensemble.model.AggregatedItem;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Component
public class ResultRanker {

    static final Comparator<AggregatedItem> RANKING_ORDER = Comparator
        .comparingDouble(AggregatedItem::finalScore).reversed()
        .thenComparing(AggregatedItem::canonicalKey);

    public List<AggregatedItem> rank(Map<String, AggregatedItem> items, int topKFinal) {
        return items.values().stream()
            .sorted(RANKING_ORDER)
            .limit(topKFinal)
            .toList();
    }
}
