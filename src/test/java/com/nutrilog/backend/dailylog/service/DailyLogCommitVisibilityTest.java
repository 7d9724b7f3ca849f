package com.nutrilog.backend.dailylog.service;

import com.nutrilog.backend.dailylog.dto.DailyLogDtos;
import com.nutrilog.backend.prediction.model.MealSlot;
import com.nutrilog.backend.prediction.model.PredictionResult;
import com.nutrilog.backend.prediction.session.PredictionPhase;
import com.nutrilog.backend.prediction.session.PredictionSession;
import com.nutrilog.backend.prediction.session.PredictionSessionRegistry;
import com.nutrilog.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * A session read while a log write is still uncommitted must not outlive the commit.
 */
@SpringBootTest
class DailyLogCommitVisibilityTest extends BaseSpringTest {

    private static final ZoneId MADRID = ZoneId.of("Europe/Madrid");

    @Autowired DailyLogService service;
    @Autowired PredictionSessionRegistry registry;
    @Autowired PlatformTransactionManager txManager;

    @Test
    void session_started_before_commit_is_replaced_once_the_row_is_visible() throws Exception {
        Long user = 201L;
        var req = new DailyLogDtos.CreateRequest(
                LocalDate.of(2026, 1, 13), "f-1", "Tortilla", MealSlot.LUNCH, 150.0,
                new DailyLogDtos.MacrosDto(300.0, 20.0, 30.0, 10.0), null);

        PredictionSession duringWrite = new TransactionTemplate(txManager).execute(status -> {
            service.create(user, MADRID, req);
            PredictionSession s = registry.getOrStart(user, MADRID);
            awaitSettled(s);
            return s;
        });

        assertThat(duringWrite).isNotNull();
        assertThat(duringWrite.isClosed()).isTrue();
        assertThat(registry.find(user)).isEmpty();

        PredictionSession afterCommit = registry.getOrStart(user, MADRID);
        awaitSettled(afterCommit);

        assertThat(afterCommit).isNotSameAs(duringWrite);
        assertThat(afterCommit.phase()).isEqualTo(PredictionPhase.HAS_RESULT);
        assertThat(afterCommit.result()).get().extracting(PredictionResult::foodName).isEqualTo("Tortilla");
    }

    private static void awaitSettled(PredictionSession s) {
        for (int i = 0; i < 100 && s.phase() == PredictionPhase.LOADING; i++) {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }
}
