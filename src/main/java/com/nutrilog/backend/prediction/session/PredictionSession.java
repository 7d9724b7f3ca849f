package com.nutrilog.backend.prediction.session;

import com.nutrilog.backend.prediction.engine.HabitPredictionEngine;
import com.nutrilog.backend.prediction.engine.HabitScoreWeights;
import com.nutrilog.backend.prediction.model.HistoricalLogRecord;
import com.nutrilog.backend.prediction.model.PredictionResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * One fetch-then-compute cycle for one user.
 *
 * <pre>
 * LOADING --fetch ok, winner--> HAS_RESULT --dismiss--> DISMISSED
 * LOADING --fetch ok, none----> NO_RESULT  --dismiss--> DISMISSED
 * LOADING --fetch failed------> NO_RESULT
 * LOADING --dismiss-----------> DISMISSED (pending fetch discarded)
 * </pre>
 *
 * Nothing re-enters LOADING; a fresh computation needs a new instance.
 * After {@link #close()} a late fetch resolution is dropped without touching state.
 * The fetch completes on another thread, so state is guarded by this object's monitor.
 */
@Slf4j
public class PredictionSession {

    private final Long userId;
    private final ZoneId zone;
    private final RecentLogFetcher fetcher;
    private final HabitPredictionEngine engine;
    private final Clock clock;

    private PredictionPhase phase = PredictionPhase.LOADING;
    private PredictionResult result;
    private boolean dismissed;
    private boolean accepting;

    private boolean started;
    private boolean closed;
    private CompletableFuture<List<HistoricalLogRecord>> pending;

    public PredictionSession(Long userId, ZoneId zone, RecentLogFetcher fetcher, HabitPredictionEngine engine, Clock clock) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Issues the single fetch of this session. Later calls, or calls after dismiss/close, do nothing. */
    public synchronized void start() {
        if (started || closed || dismissed) return;
        started = true;

        CompletableFuture<List<HistoricalLogRecord>> f;
        try {
            f = fetcher.fetchRecentLogs(userId, HabitScoreWeights.FETCH_BATCH_SIZE);
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        if (f == null) f = CompletableFuture.completedFuture(List.of());

        pending = f;
        f.whenComplete(this::onFetched);
    }

    private synchronized void onFetched(List<HistoricalLogRecord> records, Throwable error) {
        pending = null;

        if (closed || dismissed) {
            log.debug("prediction_fetch_discarded userId={} closed={} dismissed={}", userId, closed, dismissed);
            return;
        }
        if (phase != PredictionPhase.LOADING) return;

        if (error != null) {
            Throwable cause = unwrap(error);
            log.warn("prediction_fetch_failed userId={} error={} msg={}",
                    userId, cause.getClass().getSimpleName(), cause.getMessage());
            moveTo(PredictionPhase.NO_RESULT, null);
            return;
        }

        try {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
            List<HistoricalLogRecord> safe = (records == null) ? List.of() : records;
            Optional<PredictionResult> winner =
                    engine.predict(safe, now, HabitPredictionEngine.alreadyLoggedInSlot(safe, now));

            if (winner.isPresent()) moveTo(PredictionPhase.HAS_RESULT, winner.get());
            else moveTo(PredictionPhase.NO_RESULT, null);
        } catch (RuntimeException e) {
            log.warn("prediction_compute_failed userId={} records={}", userId, records == null ? 0 : records.size(), e);
            moveTo(PredictionPhase.NO_RESULT, null);
        }
    }

    /** Idempotent. Suppresses any pending or later automatic fetch for this session. */
    public synchronized void dismiss() {
        if (closed || dismissed) return;
        dismissed = true;
        moveTo(PredictionPhase.DISMISSED, null);
        cancelPending();
    }

    /**
     * Hands the suggestion to {@code logger} and dismisses once it returns.
     * While {@code logger} runs the suggestion is held: a second accept gets nothing.
     * If {@code logger} throws, the suggestion stays available and the exception propagates.
     * Empty unless the session is in {@link PredictionPhase#HAS_RESULT}.
     */
    public <T> Optional<T> accept(Function<PredictionResult, T> logger) {
        PredictionResult taken;
        synchronized (this) {
            if (closed || accepting || phase != PredictionPhase.HAS_RESULT) return Optional.empty();
            accepting = true;
            taken = result;
        }

        T out;
        try {
            out = logger.apply(taken);
        } catch (RuntimeException e) {
            synchronized (this) {
                accepting = false;
            }
            log.warn("prediction_accept_failed userId={} food={}", userId, taken.foodName());
            throw e;
        }

        synchronized (this) {
            accepting = false;
            dismiss();
        }
        return Optional.ofNullable(out);
    }

    /** Teardown. Pending work is cancelled and its resolution ignored. */
    public synchronized void close() {
        if (closed) return;
        closed = true;
        cancelPending();
        log.debug("prediction_session_closed userId={} phase={}", userId, phase);
    }

    public synchronized PredictionPhase phase() {
        return phase;
    }

    public synchronized Optional<PredictionResult> result() {
        return Optional.ofNullable(result);
    }

    public synchronized PredictionSnapshot snapshot() {
        return new PredictionSnapshot(phase, result);
    }

    /** True while an accepted suggestion is being logged. */
    public synchronized boolean isAccepting() {
        return accepting;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public Long userId() {
        return userId;
    }

    public ZoneId zone() {
        return zone;
    }

    private void moveTo(PredictionPhase next, PredictionResult nextResult) {
        log.debug("prediction_session_transition userId={} from={} to={}", userId, phase, next);
        this.phase = next;
        this.result = nextResult;
    }

    private void cancelPending() {
        CompletableFuture<List<HistoricalLogRecord>> p = pending;
        pending = null;
        if (p != null && !p.isDone()) p.cancel(false);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while (cur instanceof CompletionException && cur.getCause() != null) cur = cur.getCause();
        return cur;
    }
}
