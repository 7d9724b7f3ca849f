package com.nutrilog.backend.prediction.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * When a historical record happened, at one of two precision levels.
 * Older rows only carry a calendar date, so every time based rule must branch on the variant.
 */
public sealed interface LoggedAt permits LoggedAt.Precise, LoggedAt.DateOnly {

    /** Fine grained timestamp; enables recency window and time-of-day proximity. */
    record Precise(Instant moment) implements LoggedAt {}

    /** Only the {@code YYYY-MM-DD} the entry was filed under. */
    record DateOnly(LocalDate calendarDate) implements LoggedAt {}
}
