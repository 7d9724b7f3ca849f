package com.nutrilog.backend.prediction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nutrilog.backend.common.web.Trace;
import com.nutrilog.backend.dailylog.dto.DailyLogDtos;
import com.nutrilog.backend.prediction.model.MealSlot;
import com.nutrilog.backend.prediction.model.PredictionResult;
import com.nutrilog.backend.prediction.session.PredictionSnapshot;

public class PredictionDtos {

    /** {@code suggestion} is present only when {@code phase} is HAS_RESULT. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PredictionEnvelope(
            String phase,
            Suggestion suggestion,
            Trace trace
    ) {
        public static PredictionEnvelope of(PredictionSnapshot snap, String requestId) {
            return new PredictionEnvelope(
                    snap.phase().name(),
                    snap.result() == null ? null : Suggestion.of(snap.result()),
                    new Trace(requestId)
            );
        }
    }

    public record Suggestion(
            String foodName,
            String foodId,
            double grams,
            DailyLogDtos.MacrosDto calculated,
            MealSlot meal
    ) {
        static Suggestion of(PredictionResult r) {
            return new Suggestion(
                    r.foodName(),
                    r.foodId(),
                    r.grams(),
                    r.calculated() == null
                            ? null
                            : new DailyLogDtos.MacrosDto(
                                    r.calculated().calories(),
                                    r.calculated().protein(),
                                    r.calculated().carbs(),
                                    r.calculated().fat()),
                    r.mealSlot()
            );
        }
    }

    public record AcceptResponse(
            DailyLogDtos.Item logged,
            Trace trace
    ) {}
}
