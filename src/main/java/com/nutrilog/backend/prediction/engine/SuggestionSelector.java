package com.nutrilog.backend.prediction.engine;

import com.nutrilog.backend.prediction.model.AggregateEntry;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static com.nutrilog.backend.prediction.engine.HabitScoreWeights.SELECTION_THRESHOLD;

/**
 * Picks at most one winner: highest total score, and only if it reaches the threshold.
 * Among equal totals the earlier aggregate wins (stable sort); callers must not rely on it.
 */
public class SuggestionSelector {

    public Optional<AggregateEntry> select(List<AggregateEntry> aggregates) {
        return select(aggregates, a -> false);
    }

    /**
     * Same ranking, but candidates rejected by {@code alreadyLogged} are passed over
     * in favour of the next one still above the threshold.
     */
    public Optional<AggregateEntry> select(List<AggregateEntry> aggregates, Predicate<AggregateEntry> alreadyLogged) {
        if (aggregates == null || aggregates.isEmpty()) return Optional.empty();

        List<AggregateEntry> ranked = aggregates.stream()
                .sorted(Comparator.comparingInt(AggregateEntry::totalScore).reversed())
                .toList();

        for (AggregateEntry candidate : ranked) {
            if (candidate.totalScore() < SELECTION_THRESHOLD) break;
            if (alreadyLogged != null && alreadyLogged.test(candidate)) continue;
            return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
