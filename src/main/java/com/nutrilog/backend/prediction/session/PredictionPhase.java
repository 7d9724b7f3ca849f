package com.nutrilog.backend.prediction.session;

public enum PredictionPhase {
    LOADING,
    HAS_RESULT,
    NO_RESULT,
    /** Terminal. Only a new session leaves it. */
    DISMISSED
}
