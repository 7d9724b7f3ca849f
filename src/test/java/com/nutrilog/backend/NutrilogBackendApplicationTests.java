package com.nutrilog.backend;

import com.jayway.jsonpath.JsonPath;
import com.nutrilog.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full stack on H2 with the fixed test clock (Wednesday 2026-01-14 12:30 Madrid, MORNING_SNACK).
 */
@SpringBootTest
@AutoConfigureMockMvc
class NutrilogBackendApplicationTests extends BaseSpringTest {

    private static final String TZ = "Europe/Madrid";

    @Autowired MockMvc mvc;

    @Test
    void contextLoads() {
    }

    @Test
    void no_history_settles_on_no_result() throws Exception {
        assertThat(pollPhase("101")).isEqualTo("NO_RESULT");
    }

    @Test
    void logged_habit_is_suggested_accepted_once_and_then_excluded() throws Exception {
        String user = "102";

        // logged under yesterday's lunch but stamped by the clock just now
        mvc.perform(post("/api/v1/daily-logs")
                        .header("X-User-Id", user)
                        .header("X-Client-Timezone", TZ)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"date":"2026-01-13","meal":"LUNCH","foodId":"f-1","foodName":"Tortilla","grams":150,
                                 "calculated":{"calories":300,"protein":20,"carbs":30,"fat":10}}
                                """))
                .andExpect(status().isOk());

        assertThat(pollPhase(user)).isEqualTo("HAS_RESULT");
        mvc.perform(get("/api/v1/predictions/current").header("X-User-Id", user).header("X-Client-Timezone", TZ))
                .andExpect(jsonPath("$.suggestion.foodName").value("Tortilla"))
                .andExpect(jsonPath("$.suggestion.meal").value("MORNING_SNACK"));

        mvc.perform(post("/api/v1/predictions/current/accept").header("X-User-Id", user).header("X-Client-Timezone", TZ))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logged.date").value("2026-01-14"))
                .andExpect(jsonPath("$.logged.meal").value("MORNING_SNACK"))
                .andExpect(jsonPath("$.logged.grams").value(150.0));

        mvc.perform(post("/api/v1/predictions/current/accept").header("X-User-Id", user).header("X-Client-Timezone", TZ))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("PREDICTION_NOT_AVAILABLE"));

        // dismissal survives the log written by accept
        assertThat(pollPhase(user)).isEqualTo("DISMISSED");

        mvc.perform(delete("/api/v1/predictions/current").header("X-User-Id", user))
                .andExpect(status().isNoContent());

        // already logged for this meal today
        assertThat(pollPhase(user)).isEqualTo("NO_RESULT");

        mvc.perform(get("/api/v1/daily-logs").param("date", "2026-01-14").header("X-User-Id", user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.totals.calories").value(300.0));
    }

    @Test
    void missing_user_is_401() throws Exception {
        mvc.perform(get("/api/v1/predictions/current"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    private String pollPhase(String user) throws Exception {
        String phase = "LOADING";
        for (int i = 0; i < 100 && "LOADING".equals(phase); i++) {
            if (i > 0) Thread.sleep(50);
            String body = mvc.perform(get("/api/v1/predictions/current")
                            .header("X-User-Id", user)
                            .header("X-Client-Timezone", TZ))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            phase = JsonPath.read(body, "$.phase");
        }
        return phase;
    }
}
