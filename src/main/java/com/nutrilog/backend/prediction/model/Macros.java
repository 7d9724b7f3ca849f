package com.nutrilog.backend.prediction.model;

/** Macros of one logged serving (not per 100 g). */
public record Macros(double calories, double protein, double carbs, double fat) {

    public static final Macros ZERO = new Macros(0, 0, 0, 0);
}
