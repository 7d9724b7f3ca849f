package com.nutrilog.backend.dailylog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nutrilog.backend.common.web.Trace;
import com.nutrilog.backend.prediction.model.MealSlot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

public class DailyLogDtos {

    public record MacrosDto(
            Double calories,
            Double protein,
            Double carbs,
            Double fat
    ) {}

    /**
     * Either {@code calculated} (already scaled to grams) or {@code per100g} must be present.
     * {@code date} defaults to the client's today, {@code meal} to the slot of the client's now.
     */
    public record CreateRequest(
            LocalDate date,
            @Size(max = 64) String foodId,
            @NotBlank @Size(max = 200) String foodName,
            MealSlot meal,
            @NotNull @Positive Double grams,
            @Valid MacrosDto calculated,
            @Valid MacrosDto per100g
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Item(
            String id,
            LocalDate date,
            String foodId,
            String foodName,
            MealSlot meal,
            Double grams,
            MacrosDto calculated,
            String createdAtUtc
    ) {}

    public record DayResponse(
            LocalDate date,
            List<Item> items,
            MacrosDto totals,
            Trace trace
    ) {}
}
