package com.nutrilog.backend.prediction.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.nutrilog.backend.prediction.engine.HabitPredictionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Owns at most one live {@link PredictionSession} per user.
 *
 * <p>A session is replaced only on a dependency change: a different client zone, an explicit reset,
 * or a change to the user's logs while not dismissed. Expired or size-evicted sessions are closed.
 */
@Slf4j
@Component
public class PredictionSessionRegistry {

    private final RecentLogFetcher fetcher;
    private final HabitPredictionEngine engine;
    private final Clock clock;
    private final Cache<Long, PredictionSession> sessions;

    public PredictionSessionRegistry(
            PredictionSessionProperties props,
            RecentLogFetcher fetcher,
            HabitPredictionEngine engine,
            Clock clock
    ) {
        this.fetcher = fetcher;
        this.engine = engine;
        this.clock = clock;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(props.getTtl())
                .maximumSize(props.getMaxSize())
                .evictionListener((Long userId, PredictionSession s, RemovalCause cause) -> {
                    if (s != null) s.close();
                    log.debug("prediction_session_evicted userId={} cause={}", userId, cause);
                })
                .build();
    }

    /** Current session for the user, creating and starting one when missing or bound to another zone. */
    public PredictionSession getOrStart(Long userId, ZoneId zone) {
        PredictionSession s = sessions.asMap().compute(userId, (uid, existing) -> {
            if (existing != null && existing.zone().equals(zone)) return existing;
            if (existing != null) existing.close();
            return newSession(uid, zone);
        });
        s.start();
        return s;
    }

    /**
     * Dismisses the user's session. With no live session a dismissed one is put in place
     * without fetching, so later reads stay quiet.
     */
    public PredictionSession dismiss(Long userId, ZoneId zone) {
        PredictionSession s = sessions.asMap().computeIfAbsent(userId, uid -> newSession(uid, zone));
        s.dismiss();
        return s;
    }

    public Optional<PredictionSession> find(Long userId) {
        return Optional.ofNullable(sessions.getIfPresent(userId));
    }

    /** Explicit teardown; the next read starts over, dismissal included. */
    public void reset(Long userId) {
        PredictionSession s = sessions.asMap().remove(userId);
        if (s != null) s.close();
    }

    /**
     * The user's logs changed. A dismissed session survives so dismissal keeps suppressing re-fetch;
     * so does one whose suggestion is being logged right now, since it is about to be dismissed.
     */
    public void onLogsChanged(Long userId) {
        sessions.asMap().computeIfPresent(userId, (uid, s) -> {
            if (s.phase() == PredictionPhase.DISMISSED || s.isAccepting()) return s;
            s.close();
            return null;
        });
    }

    private PredictionSession newSession(Long userId, ZoneId zone) {
        log.debug("prediction_session_created userId={} zone={}", userId, zone);
        return new PredictionSession(userId, zone, fetcher, engine, clock);
    }
}
