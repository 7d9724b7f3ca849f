package com.nutrilog.backend.prediction.controller;

import com.nutrilog.backend.auth.security.AuthContext;
import com.nutrilog.backend.common.web.ClientTimeZoneResolver;
import com.nutrilog.backend.common.web.RequestIdFilter;
import com.nutrilog.backend.common.web.Trace;
import com.nutrilog.backend.prediction.dto.PredictionDtos;
import com.nutrilog.backend.prediction.service.PredictionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Prediction", description = "Habit based one-tap meal suggestion")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/predictions")
public class PredictionController {

    private final AuthContext auth;
    private final ClientTimeZoneResolver zones;
    private final PredictionService service;

    /**
     * Poll until phase is no longer LOADING. Repeated reads do not re-score.
     */
    @GetMapping("/current")
    public PredictionDtos.PredictionEnvelope current(HttpServletRequest req) {
        Long uid = auth.requireUserId();
        return PredictionDtos.PredictionEnvelope.of(
                service.current(uid, zones.resolve(req)),
                RequestIdFilter.getOrCreate(req)
        );
    }

    @PostMapping("/current/dismiss")
    public PredictionDtos.PredictionEnvelope dismiss(HttpServletRequest req) {
        Long uid = auth.requireUserId();
        return PredictionDtos.PredictionEnvelope.of(
                service.dismiss(uid, zones.resolve(req)),
                RequestIdFilter.getOrCreate(req)
        );
    }

    @PostMapping("/current/accept")
    public PredictionDtos.AcceptResponse accept(HttpServletRequest req) {
        Long uid = auth.requireUserId();
        return new PredictionDtos.AcceptResponse(
                service.accept(uid, zones.resolve(req)),
                new Trace(RequestIdFilter.getOrCreate(req))
        );
    }

    @DeleteMapping("/current")
    public ResponseEntity<Void> reset() {
        Long uid = auth.requireUserId();
        service.reset(uid);
        return ResponseEntity.noContent().build();
    }
}
