package com.nutrilog.backend.prediction.engine;

import com.nutrilog.backend.prediction.model.MealSlot;

import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Wall-clock time to meal slot:
 * [05:00,11:00) BREAKFAST, [11:00,13:00) MORNING_SNACK, [13:00,17:00) LUNCH,
 * [17:00,19:00) AFTERNOON_SNACK, everything else (overnight wrap included) DINNER.
 */
public final class MealSlotResolver {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private static final int BREAKFAST_FROM = 5 * 60;
    private static final int MORNING_SNACK_FROM = 11 * 60;
    private static final int LUNCH_FROM = 13 * 60;
    private static final int AFTERNOON_SNACK_FROM = 17 * 60;
    private static final int DINNER_FROM = 19 * 60;

    private MealSlotResolver() {}

    public static MealSlot resolve(ZonedDateTime now) {
        return resolve(now.toLocalTime());
    }

    public static MealSlot resolve(LocalTime time) {
        return forMinuteOfDay(minuteOfDay(time));
    }

    /** Total: any int is folded into 0..1439 first. */
    public static MealSlot forMinuteOfDay(int minuteOfDay) {
        int m = Math.floorMod(minuteOfDay, MINUTES_PER_DAY);
        if (m >= BREAKFAST_FROM && m < MORNING_SNACK_FROM) return MealSlot.BREAKFAST;
        if (m >= MORNING_SNACK_FROM && m < LUNCH_FROM) return MealSlot.MORNING_SNACK;
        if (m >= LUNCH_FROM && m < AFTERNOON_SNACK_FROM) return MealSlot.LUNCH;
        if (m >= AFTERNOON_SNACK_FROM && m < DINNER_FROM) return MealSlot.AFTERNOON_SNACK;
        return MealSlot.DINNER;
    }

    /** Hours and minutes only; seconds are ignored. */
    public static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
