package com.nutrilog.backend.prediction.engine;

import java.time.Duration;

/**
 * Engine-wide constants. Not configuration: changing any of these changes what "a habit" means.
 */
public final class HabitScoreWeights {

    private HabitScoreWeights() {}

    /** Logged at all. */
    public static final int BASE = 10;

    /** Logged within the recency window (or, date-only, on today's date). */
    public static final int RECENCY = 50;

    /** Logged within the proximity window of the current time of day. */
    public static final int PROXIMITY = 30;

    /** Logged on the same weekday as now. */
    public static final int WEEKDAY = 20;

    public static final Duration RECENCY_WINDOW = Duration.ofHours(24);

    public static final int PROXIMITY_WINDOW_MINUTES = 60;

    /** Minimum aggregate score that produces a suggestion. */
    public static final int SELECTION_THRESHOLD = 40;

    /** How many recent log entries one session fetches. */
    public static final int FETCH_BATCH_SIZE = 50;
}
