package com.nutrilog.backend.dailylog.entity;

import com.nutrilog.backend.prediction.model.MealSlot;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One serving logged against a meal. Macros are stored already scaled to {@code grams}.
 * {@code createdAtUtc} is null on rows imported from before timestamps were kept;
 * those only have {@code logDate}.
 */
@Getter
@Setter
@Entity
@Table(
        name = "daily_logs",
        indexes = {
                @Index(name = "idx_daily_logs_user_created", columnList = "user_id, created_at_utc"),
                @Index(name = "idx_daily_logs_user_date", columnList = "user_id, log_date")
        }
)
public class DailyLogEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "log_date")
    private LocalDate logDate;

    @Column(name = "food_id", length = 64)
    private String foodId;

    @Column(name = "food_name", nullable = false, length = 200)
    private String foodName;

    @Enumerated(EnumType.STRING)
    @Column(name = "meal", nullable = false, length = 16)
    private MealSlot meal;

    @Column(name = "grams", nullable = false)
    private Double grams;

    @Column(name = "calories", nullable = false)
    private Double calories;

    @Column(name = "protein", nullable = false)
    private Double protein;

    @Column(name = "carbs", nullable = false)
    private Double carbs;

    @Column(name = "fat", nullable = false)
    private Double fat;

    @Column(name = "created_at_utc")
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }
}
