package com.nutrilog.backend.dailylog.controller;

import com.nutrilog.backend.auth.security.AuthContext;
import com.nutrilog.backend.common.web.ClientTimeZoneResolver;
import com.nutrilog.backend.common.web.RequestIdFilter;
import com.nutrilog.backend.dailylog.dto.DailyLogDtos;
import com.nutrilog.backend.dailylog.service.DailyLogService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@Tag(name = "DailyLog", description = "Logged servings per day and meal")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/daily-logs")
public class DailyLogController {

    private final AuthContext auth;
    private final ClientTimeZoneResolver zones;
    private final DailyLogService service;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public DailyLogDtos.Item create(
            @Valid @RequestBody DailyLogDtos.CreateRequest body,
            HttpServletRequest req
    ) {
        Long uid = auth.requireUserId();
        return service.create(uid, zones.resolve(req), body);
    }

    @GetMapping
    public DailyLogDtos.DayResponse listForDay(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            HttpServletRequest req
    ) {
        Long uid = auth.requireUserId();
        return service.listForDay(uid, date, RequestIdFilter.getOrCreate(req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        Long uid = auth.requireUserId();
        service.delete(uid, id);
        return ResponseEntity.noContent().build();
    }
}
