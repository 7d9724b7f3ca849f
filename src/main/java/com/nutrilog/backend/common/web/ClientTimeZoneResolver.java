package com.nutrilog.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * The caller's zone decides what "now", "today" and the current meal slot are.
 * A present but unknown zone id fails with {@link java.time.DateTimeException} (400).
 */
@Component
public class ClientTimeZoneResolver {

    static final String[] HEADERS = {"X-Client-Timezone", "X-Client-TZ", "Time-Zone", "X-Timezone"};

    public ZoneId resolve(HttpServletRequest req) {
        if (req != null) {
            for (String k : HEADERS) {
                String v = req.getHeader(k);
                if (v != null && !v.isBlank()) return ZoneId.of(v.trim());
            }
        }
        return ZoneId.systemDefault();
    }
}
