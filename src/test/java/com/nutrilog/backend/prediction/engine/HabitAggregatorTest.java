package com.nutrilog.backend.prediction.engine;

import com.nutrilog.backend.prediction.model.AggregateEntry;
import com.nutrilog.backend.prediction.model.HistoricalLogRecord;
import com.nutrilog.backend.prediction.model.ScoredEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nutrilog.backend.prediction.HabitFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class HabitAggregatorTest {

    private final HabitAggregator aggregator = new HabitAggregator();

    @Test
    void sums_per_identity_in_order_of_first_appearance() {
        HistoricalLogRecord a1 = dateOnly("Arroz", "2026-01-10");
        HistoricalLogRecord b1 = dateOnly("Bocadillo", "2026-01-10");
        HistoricalLogRecord a2 = dateOnly("Arroz", "2026-01-09");

        List<AggregateEntry> out = aggregator.aggregate(List.of(
                new ScoredEntry("Arroz", 25, a1),
                new ScoredEntry("Bocadillo", 60, b1),
                new ScoredEntry("Arroz", 20, a2)
        ));

        assertThat(out).extracting(AggregateEntry::identity).containsExactly("Arroz", "Bocadillo");
        assertThat(out).extracting(AggregateEntry::totalScore).containsExactly(45, 60);
    }

    @Test
    void representative_is_the_first_record_even_when_a_later_one_scores_higher() {
        HistoricalLogRecord first = withGrams(dateOnly("Arroz con pollo", "2026-01-01"), 180);
        HistoricalLogRecord better = withGrams(dateOnly("Arroz con pollo", "2026-01-14"), 250);

        List<AggregateEntry> out = aggregator.aggregate(List.of(
                new ScoredEntry("Arroz con pollo", 10, first),
                new ScoredEntry("Arroz con pollo", 110, better)
        ));

        assertThat(out).hasSize(1);
        assertThat(out.get(0).representative()).isSameAs(first);
        assertThat(out.get(0).representative().grams()).isEqualTo(180);
        assertThat(out.get(0).totalScore()).isEqualTo(120);
    }

    @Test
    void identity_is_case_sensitive_and_not_trimmed() {
        List<AggregateEntry> out = aggregator.aggregate(List.of(
                new ScoredEntry("Tortilla", 10, dateOnly("Tortilla", "2026-01-10")),
                new ScoredEntry("tortilla", 10, dateOnly("tortilla", "2026-01-10")),
                new ScoredEntry("Tortilla ", 10, dateOnly("Tortilla ", "2026-01-10"))
        ));

        assertThat(out).hasSize(3);
    }

    @Test
    void empty_or_null_input_gives_no_aggregates() {
        assertThat(aggregator.aggregate(List.of())).isEmpty();
        assertThat(aggregator.aggregate(null)).isEmpty();
    }
}
