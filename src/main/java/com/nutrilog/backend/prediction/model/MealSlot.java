package com.nutrilog.backend.prediction.model;

/**
 * Five fixed eating occasions of a day, in chronological order.
 * Stored by name in {@code daily_logs.meal}.
 */
public enum MealSlot {
    BREAKFAST,
    MORNING_SNACK,
    LUNCH,
    AFTERNOON_SNACK,
    DINNER
}
