package com.nutrilog.backend.dailylog.service;

import com.nutrilog.backend.common.web.Trace;
import com.nutrilog.backend.dailylog.dto.DailyLogDtos;
import com.nutrilog.backend.dailylog.entity.DailyLogEntity;
import com.nutrilog.backend.dailylog.repo.DailyLogRepository;
import com.nutrilog.backend.prediction.engine.MealSlotResolver;
import com.nutrilog.backend.prediction.model.Macros;
import com.nutrilog.backend.prediction.model.PredictionResult;
import com.nutrilog.backend.prediction.session.PredictionSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Service
public class DailyLogService {

    private final DailyLogRepository repo;
    private final PredictionSessionRegistry predictionSessions;
    private final Clock clock;

    @Transactional
    public DailyLogDtos.Item create(Long userId, ZoneId zone, DailyLogDtos.CreateRequest req) {
        if (req == null) throw new IllegalArgumentException("BAD_REQUEST");
        if (req.foodName() == null || req.foodName().isBlank()) throw new IllegalArgumentException("FOOD_NAME_REQUIRED");
        if (req.grams() == null || !(req.grams() > 0)) throw new IllegalArgumentException("GRAMS_INVALID");

        Macros calculated = resolveCalculated(req.grams(), req.calculated(), req.per100g());
        Instant now = Instant.now(clock);

        DailyLogEntity e = new DailyLogEntity();
        e.setUserId(userId);
        e.setLogDate(req.date() != null ? req.date() : LocalDate.ofInstant(now, zone));
        e.setFoodId(req.foodId());
        // stored verbatim: the name is the habit grouping key
        e.setFoodName(req.foodName());
        e.setMeal(req.meal() != null ? req.meal() : MealSlotResolver.resolve(now.atZone(zone)));
        e.setGrams(req.grams());
        e.setCalories(calculated.calories());
        e.setProtein(calculated.protein());
        e.setCarbs(calculated.carbs());
        e.setFat(calculated.fat());
        e.setCreatedAtUtc(now);

        DailyLogEntity saved = repo.save(e);
        notifyLogsChangedAfterCommit(userId);

        log.info("daily_log_created userId={} id={} date={} meal={}", userId, saved.getId(), saved.getLogDate(), saved.getMeal());
        return toItem(saved);
    }

    /** Logs an accepted suggestion for the client's today, in the suggested slot. */
    @Transactional
    public DailyLogDtos.Item logPrediction(Long userId, ZoneId zone, PredictionResult p) {
        Macros m = (p.calculated() == null) ? Macros.ZERO : p.calculated();
        return create(userId, zone, new DailyLogDtos.CreateRequest(
                null,
                p.foodId(),
                p.foodName(),
                p.mealSlot(),
                p.grams(),
                new DailyLogDtos.MacrosDto(m.calories(), m.protein(), m.carbs(), m.fat()),
                null
        ));
    }

    @Transactional(readOnly = true)
    public DailyLogDtos.DayResponse listForDay(Long userId, LocalDate date, String requestId) {
        if (date == null) throw new IllegalArgumentException("DATE_REQUIRED");

        List<DailyLogDtos.Item> items = repo.findByUserIdAndLogDateOrderByCreatedAtUtcAsc(userId, date)
                .stream()
                .map(DailyLogService::toItem)
                .toList();

        double kcal = 0, protein = 0, carbs = 0, fat = 0;
        for (DailyLogDtos.Item it : items) {
            kcal += it.calculated().calories();
            protein += it.calculated().protein();
            carbs += it.calculated().carbs();
            fat += it.calculated().fat();
        }

        return new DailyLogDtos.DayResponse(
                date,
                items,
                new DailyLogDtos.MacrosDto(round1(kcal), round1(protein), round1(carbs), round1(fat)),
                new Trace(requestId)
        );
    }

    @Transactional
    public void delete(Long userId, String id) {
        DailyLogEntity e = repo.findByIdAndUserId(id, userId)
                .orElseThrow(() -> new IllegalArgumentException("DAILY_LOG_NOT_FOUND"));
        repo.delete(e);
        notifyLogsChangedAfterCommit(userId);
        log.info("daily_log_deleted userId={} id={}", userId, id);
    }

    /**
     * A session started before the commit cannot see the new row, so it is torn down only once the row is visible.
     * Rolled back writes leave the sessions alone.
     */
    private void notifyLogsChangedAfterCommit(Long userId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            predictionSessions.onLogsChanged(userId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override public void afterCommit() {
                predictionSessions.onLogsChanged(userId);
            }
        });
    }

    /**
     * {@code calculated} wins when given (missing parts count as 0);
     * otherwise per-100 g values are scaled to grams.
     */
    static Macros resolveCalculated(double grams, DailyLogDtos.MacrosDto calculated, DailyLogDtos.MacrosDto per100g) {
        if (calculated != null) {
            return new Macros(
                    nz(calculated.calories()),
                    nz(calculated.protein()),
                    nz(calculated.carbs()),
                    nz(calculated.fat())
            );
        }
        if (per100g != null) {
            double f = grams / 100.0;
            return new Macros(
                    round1(nz(per100g.calories()) * f),
                    round1(nz(per100g.protein()) * f),
                    round1(nz(per100g.carbs()) * f),
                    round1(nz(per100g.fat()) * f)
            );
        }
        throw new IllegalArgumentException("MACROS_REQUIRED");
    }

    static DailyLogDtos.Item toItem(DailyLogEntity e) {
        return new DailyLogDtos.Item(
                e.getId(),
                e.getLogDate(),
                e.getFoodId(),
                e.getFoodName(),
                e.getMeal(),
                e.getGrams(),
                new DailyLogDtos.MacrosDto(
                        nz(e.getCalories()),
                        nz(e.getProtein()),
                        nz(e.getCarbs()),
                        nz(e.getFat())
                ),
                e.getCreatedAtUtc() == null ? null : e.getCreatedAtUtc().toString()
        );
    }

    private static double nz(Double v) {
        return (v == null || v.isNaN()) ? 0.0 : v;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
