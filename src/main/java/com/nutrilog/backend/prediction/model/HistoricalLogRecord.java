package com.nutrilog.backend.prediction.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Read-only view of one past log entry as handed to the suggestion engine.
 *
 * <p>{@code foodIdentity} is the display name and is used verbatim as the grouping key:
 * case-sensitive, not normalised. Two different foods sharing a name are merged.
 *
 * @param calendarDate  {@code YYYY-MM-DD}, may be null only on malformed rows
 * @param preciseMoment null on rows written before timestamps were recorded
 */
public record HistoricalLogRecord(
        String foodIdentity,
        String foodId,
        double grams,
        MealSlot mealSlot,
        String calendarDate,
        Instant preciseMoment,
        Macros macros
) {

    /**
     * Precise moment when present, otherwise the parsed calendar date.
     * Empty when the row has neither (or the date string is not ISO), which makes it unusable.
     */
    public Optional<LoggedAt> whenLogged() {
        if (preciseMoment != null) return Optional.of(new LoggedAt.Precise(preciseMoment));
        if (calendarDate == null || calendarDate.isBlank()) return Optional.empty();
        try {
            return Optional.of(new LoggedAt.DateOnly(LocalDate.parse(calendarDate)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
