package com.nutrilog.backend.prediction.model;

/**
 * Summed habit score of every record sharing one identity.
 * {@code representative} is the first record seen for the identity in input order,
 * not the highest scoring one.
 */
public record AggregateEntry(String identity, int totalScore, HistoricalLogRecord representative) {}
