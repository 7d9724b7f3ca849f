package com.nutrilog.backend.dailylog.service;

import com.nutrilog.backend.dailylog.entity.DailyLogEntity;
import com.nutrilog.backend.dailylog.repo.DailyLogRepository;
import com.nutrilog.backend.prediction.model.HistoricalLogRecord;
import com.nutrilog.backend.prediction.model.LoggedAt;
import com.nutrilog.backend.prediction.model.MealSlot;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class DailyLogRecentFetcherTest {

    private final TaskExecutor direct = Runnable::run;

    @Test
    void asks_the_store_for_the_requested_page_and_maps_rows() {
        DailyLogRepository repo = mock(DailyLogRepository.class);
        when(repo.findRecentByUserId(7L, PageRequest.of(0, 50))).thenReturn(List.of(
                row("Tortilla", LocalDate.of(2026, 1, 14), Instant.parse("2026-01-14T10:00:00Z")),
                row("Paella", LocalDate.of(2026, 1, 7), null)
        ));

        List<HistoricalLogRecord> out = new DailyLogRecentFetcher(repo, direct).fetchRecentLogs(7L, 50).join();

        assertThat(out).hasSize(2);
        HistoricalLogRecord first = out.get(0);
        assertThat(first.foodIdentity()).isEqualTo("Tortilla");
        assertThat(first.foodId()).isEqualTo("food-Tortilla");
        assertThat(first.grams()).isEqualTo(120.0);
        assertThat(first.mealSlot()).isEqualTo(MealSlot.LUNCH);
        assertThat(first.calendarDate()).isEqualTo("2026-01-14");
        assertThat(first.whenLogged()).contains(new LoggedAt.Precise(Instant.parse("2026-01-14T10:00:00Z")));
        assertThat(first.macros().calories()).isEqualTo(240.0);

        assertThat(out.get(1).whenLogged()).contains(new LoggedAt.DateOnly(LocalDate.of(2026, 1, 7)));
    }

    @Test
    void store_failure_completes_exceptionally() {
        DailyLogRepository repo = mock(DailyLogRepository.class);
        when(repo.findRecentByUserId(anyLong(), any())).thenThrow(new DataAccessResourceFailureException("db down"));

        CompletableFuture<List<HistoricalLogRecord>> f = new DailyLogRecentFetcher(repo, direct).fetchRecentLogs(7L, 50);

        assertThat(f).isCompletedExceptionally();
        assertThatThrownBy(f::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void missing_macros_read_as_zero() {
        DailyLogEntity e = row("Agua", LocalDate.of(2026, 1, 14), null);
        e.setCalories(null);
        e.setGrams(null);

        HistoricalLogRecord r = DailyLogRecentFetcher.toRecord(e);

        assertThat(r.macros().calories()).isZero();
        assertThat(r.grams()).isZero();
    }

    private static DailyLogEntity row(String name, LocalDate date, Instant createdAt) {
        DailyLogEntity e = new DailyLogEntity();
        e.setId("id-" + name);
        e.setUserId(7L);
        e.setFoodId("food-" + name);
        e.setFoodName(name);
        e.setMeal(MealSlot.LUNCH);
        e.setLogDate(date);
        e.setGrams(120.0);
        e.setCalories(240.0);
        e.setProtein(10.0);
        e.setCarbs(20.0);
        e.setFat(5.0);
        e.setCreatedAtUtc(createdAt);
        return e;
    }
}
