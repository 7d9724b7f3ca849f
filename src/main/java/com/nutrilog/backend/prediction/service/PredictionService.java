package com.nutrilog.backend.prediction.service;

import com.nutrilog.backend.dailylog.dto.DailyLogDtos;
import com.nutrilog.backend.dailylog.service.DailyLogService;
import com.nutrilog.backend.prediction.session.PredictionSessionRegistry;
import com.nutrilog.backend.prediction.session.PredictionSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;

@Slf4j
@RequiredArgsConstructor
@Service
public class PredictionService {

    private final PredictionSessionRegistry sessions;
    private final DailyLogService dailyLogService;

    /** Never blocks on the fetch: a fresh session answers LOADING until it resolves. */
    public PredictionSnapshot current(Long userId, ZoneId zone) {
        return sessions.getOrStart(userId, zone).snapshot();
    }

    public PredictionSnapshot dismiss(Long userId, ZoneId zone) {
        PredictionSnapshot snap = sessions.dismiss(userId, zone).snapshot();
        log.debug("prediction_dismissed userId={}", userId);
        return snap;
    }

    /**
     * Logs the current suggestion for today, then dismisses it.
     * A failed save leaves the suggestion in place so the caller can retry.
     */
    public DailyLogDtos.Item accept(Long userId, ZoneId zone) {
        DailyLogDtos.Item logged = sessions.find(userId)
                .flatMap(s -> s.accept(p -> dailyLogService.logPrediction(userId, zone, p)))
                .orElseThrow(() -> new IllegalStateException("PREDICTION_NOT_AVAILABLE"));

        log.info("prediction_accepted userId={} food={} meal={}", userId, logged.foodName(), logged.meal());
        return logged;
    }

    public void reset(Long userId) {
        sessions.reset(userId);
    }
}
