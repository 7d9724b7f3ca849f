package com.nutrilog.backend.prediction.engine;

import com.nutrilog.backend.prediction.model.HistoricalLogRecord;
import com.nutrilog.backend.prediction.model.LoggedAt;
import com.nutrilog.backend.prediction.model.ScoredEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;

import static com.nutrilog.backend.prediction.engine.HabitScoreWeights.*;

/**
 * Scores one historical record against "now". Additive:
 * <ul>
 *   <li>base: always</li>
 *   <li>recency: precise moment within [now-24h, now]; date-only rows only when the date is today</li>
 *   <li>proximity: precise moment only, minute-of-day within 60 of now (no wrap across midnight)</li>
 *   <li>weekday: same day of week as now</li>
 * </ul>
 * Time-of-day and weekday of a precise moment are read in the zone of {@code now}.
 */
@Slf4j
public class HabitScorer {

    /**
     * @return empty when the record cannot be scored (no usable timestamp or no identity)
     */
    public Optional<ScoredEntry> score(HistoricalLogRecord record, ZonedDateTime now) {
        if (record == null) return Optional.empty();
        if (record.foodIdentity() == null) {
            log.debug("habit_record_skipped reason=NO_IDENTITY foodId={}", record.foodId());
            return Optional.empty();
        }

        Optional<LoggedAt> when = record.whenLogged();
        if (when.isEmpty()) {
            log.debug("habit_record_skipped reason=NO_TIMESTAMP foodId={} calendarDate={}",
                    record.foodId(), record.calendarDate());
            return Optional.empty();
        }

        int score = BASE;
        DayOfWeek recordDay;

        LoggedAt at = when.get();
        if (at instanceof LoggedAt.Precise p) {
            ZonedDateTime moment = p.moment().atZone(now.getZone());

            Duration age = Duration.between(p.moment(), now.toInstant());
            if (!age.isNegative() && age.compareTo(RECENCY_WINDOW) <= 0) {
                score += RECENCY;
            }

            int nowMinute = MealSlotResolver.minuteOfDay(now.toLocalTime());
            int recordMinute = MealSlotResolver.minuteOfDay(moment.toLocalTime());
            if (Math.abs(nowMinute - recordMinute) <= PROXIMITY_WINDOW_MINUTES) {
                score += PROXIMITY;
            }

            recordDay = moment.getDayOfWeek();
        } else {
            LoggedAt.DateOnly d = (LoggedAt.DateOnly) at;
            // no partial credit for yesterday, and never a proximity bonus
            if (d.calendarDate().equals(now.toLocalDate())) {
                score += RECENCY;
            }
            recordDay = d.calendarDate().getDayOfWeek();
        }

        if (recordDay == now.getDayOfWeek()) {
            score += WEEKDAY;
        }

        return Optional.of(new ScoredEntry(record.foodIdentity(), score, record));
    }
}
