package com.nutrilog.backend.prediction.session;

import com.nutrilog.backend.prediction.model.HistoricalLogRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Source of a user's recent log entries.
 * Best effort newest-first; the engine copes with any order.
 * Store errors are reported by completing the future exceptionally, never by throwing.
 */
public interface RecentLogFetcher {

    CompletableFuture<List<HistoricalLogRecord>> fetchRecentLogs(Long userId, int limit);
}
