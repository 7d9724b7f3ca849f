package com.nutrilog.backend.prediction.model;

public record ScoredEntry(String identity, int score, HistoricalLogRecord source) {}
