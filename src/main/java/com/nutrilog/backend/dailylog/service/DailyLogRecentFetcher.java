package com.nutrilog.backend.dailylog.service;

import com.nutrilog.backend.dailylog.entity.DailyLogEntity;
import com.nutrilog.backend.dailylog.repo.DailyLogRepository;
import com.nutrilog.backend.prediction.model.HistoricalLogRecord;
import com.nutrilog.backend.prediction.model.Macros;
import com.nutrilog.backend.prediction.session.RecentLogFetcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the most recent daily logs off the request thread and hands them to the suggestion engine.
 */
@Component
public class DailyLogRecentFetcher implements RecentLogFetcher {

    private final DailyLogRepository repo;
    private final TaskExecutor executor;

    public DailyLogRecentFetcher(
            DailyLogRepository repo,
            @Qualifier("predictionFetchExecutor") TaskExecutor executor
    ) {
        this.repo = repo;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<HistoricalLogRecord>> fetchRecentLogs(Long userId, int limit) {
        int size = Math.max(1, limit);
        return CompletableFuture.supplyAsync(
                () -> repo.findRecentByUserId(userId, PageRequest.of(0, size))
                        .stream()
                        .map(DailyLogRecentFetcher::toRecord)
                        .toList(),
                executor
        );
    }

    static HistoricalLogRecord toRecord(DailyLogEntity e) {
        return new HistoricalLogRecord(
                e.getFoodName(),
                e.getFoodId(),
                e.getGrams() == null ? 0.0 : e.getGrams(),
                e.getMeal(),
                e.getLogDate() == null ? null : e.getLogDate().toString(),
                e.getCreatedAtUtc(),
                new Macros(
                        nz(e.getCalories()),
                        nz(e.getProtein()),
                        nz(e.getCarbs()),
                        nz(e.getFat())
                )
        );
    }

    private static double nz(Double v) {
        return v == null ? 0.0 : v;
    }
}
