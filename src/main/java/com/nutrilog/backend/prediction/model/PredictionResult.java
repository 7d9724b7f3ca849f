package com.nutrilog.backend.prediction.model;

/** The one-tap suggestion. Recomputed per session, never persisted. */
public record PredictionResult(
        String foodName,
        String foodId,
        double grams,
        Macros calculated,
        MealSlot mealSlot
) {}
