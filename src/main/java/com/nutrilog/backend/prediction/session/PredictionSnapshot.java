package com.nutrilog.backend.prediction.session;

import com.nutrilog.backend.prediction.model.PredictionResult;

/** Consistent read of a session; {@code result} is non-null only in {@link PredictionPhase#HAS_RESULT}. */
public record PredictionSnapshot(PredictionPhase phase, PredictionResult result) {}
