package com.nutrilog.backend.prediction.engine;

import com.nutrilog.backend.prediction.model.AggregateEntry;
import com.nutrilog.backend.prediction.model.HistoricalLogRecord;
import com.nutrilog.backend.prediction.model.MealSlot;
import com.nutrilog.backend.prediction.model.PredictionResult;
import com.nutrilog.backend.prediction.model.ScoredEntry;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scorer, aggregator and selector composed into one synchronous call.
 * No I/O and no state between calls: same records and same {@code now} give the same answer.
 */
@Component
public class HabitPredictionEngine {

    private final HabitScorer scorer;
    private final HabitAggregator aggregator;
    private final SuggestionSelector selector;

    public HabitPredictionEngine() {
        this(new HabitScorer(), new HabitAggregator(), new SuggestionSelector());
    }

    HabitPredictionEngine(HabitScorer scorer, HabitAggregator aggregator, SuggestionSelector selector) {
        this.scorer = scorer;
        this.aggregator = aggregator;
        this.selector = selector;
    }

    public Optional<PredictionResult> predict(List<HistoricalLogRecord> records, ZonedDateTime now) {
        return predict(records, now, Set.of());
    }

    /**
     * @param loggedForCurrentSlot food names already logged today in the slot of {@code now};
     *                             those are never suggested again
     */
    public Optional<PredictionResult> predict(
            List<HistoricalLogRecord> records,
            ZonedDateTime now,
            Set<String> loggedForCurrentSlot
    ) {
        if (records == null || records.isEmpty()) return Optional.empty();

        List<ScoredEntry> scored = new ArrayList<>(records.size());
        for (HistoricalLogRecord r : records) {
            scorer.score(r, now).ifPresent(scored::add);
        }

        List<AggregateEntry> aggregates = aggregator.aggregate(scored);

        Set<String> excluded = (loggedForCurrentSlot == null) ? Set.of() : loggedForCurrentSlot;
        MealSlot slot = MealSlotResolver.resolve(now);

        return selector.select(aggregates, a -> excluded.contains(a.identity()))
                .map(winner -> toResult(winner.representative(), slot));
    }

    /**
     * Food names filed today under the slot of {@code now}, read from the fetched batch itself.
     * Entries beyond the fetch window are not seen.
     */
    public static Set<String> alreadyLoggedInSlot(List<HistoricalLogRecord> records, ZonedDateTime now) {
        if (records == null || records.isEmpty()) return Set.of();

        String today = now.toLocalDate().toString();
        MealSlot slot = MealSlotResolver.resolve(now);

        Set<String> out = new HashSet<>();
        for (HistoricalLogRecord r : records) {
            if (r == null || r.foodIdentity() == null) continue;
            if (r.mealSlot() == slot && today.equals(r.calendarDate())) out.add(r.foodIdentity());
        }
        return out;
    }

    // suggested into the slot of now, not the slot the representative was filed under
    private static PredictionResult toResult(HistoricalLogRecord r, MealSlot slot) {
        return new PredictionResult(r.foodIdentity(), r.foodId(), r.grams(), r.macros(), slot);
    }
}
