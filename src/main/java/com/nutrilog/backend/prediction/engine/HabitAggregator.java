package com.nutrilog.backend.prediction.engine;

import com.nutrilog.backend.prediction.model.AggregateEntry;
import com.nutrilog.backend.prediction.model.HistoricalLogRecord;
import com.nutrilog.backend.prediction.model.ScoredEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds scored records into one total per food identity.
 * Output is in order of first appearance; the representative record is pinned to that first appearance.
 */
public class HabitAggregator {

    public List<AggregateEntry> aggregate(List<ScoredEntry> scored) {
        if (scored == null || scored.isEmpty()) return List.of();

        Map<String, Acc> byIdentity = new LinkedHashMap<>();
        for (ScoredEntry e : scored) {
            if (e == null) continue;
            byIdentity.computeIfAbsent(e.identity(), k -> new Acc(e.source())).total += e.score();
        }

        List<AggregateEntry> out = new ArrayList<>(byIdentity.size());
        for (Map.Entry<String, Acc> it : byIdentity.entrySet()) {
            out.add(new AggregateEntry(it.getKey(), it.getValue().total, it.getValue().representative));
        }
        return out;
    }

    private static final class Acc {
        private final HistoricalLogRecord representative;
        private int total;

        private Acc(HistoricalLogRecord representative) {
            this.representative = representative;
        }
    }
}
