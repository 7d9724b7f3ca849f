package com.nutrilog.backend.auth.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.server.ResponseStatusException;

import java.security.Principal;

/**
 * Resolves the calling user's id. Authentication happens upstream (gateway / container);
 * this only reads what it left behind.
 */
@Component
public class AuthContext {

    public static final String USER_ID_ATTR = "userId";
    public static final String USER_ID_HEADER = "X-User-Id";

    public Long requireUserId() {
        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest req = attrs.getRequest();

            // 1) container principal
            Principal p = req.getUserPrincipal();
            if (p != null) {
                Long id = parseOrNull(p.getName());
                if (id != null) return id;
            }

            // 2) attribute set by an upstream filter
            Object v = req.getAttribute(USER_ID_ATTR);
            if (v instanceof Long l) return l;
            if (v instanceof String s) {
                Long id = parseOrNull(s);
                if (id != null) return id;
            }

            // 3) header forwarded by the gateway
            Long id = parseOrNull(req.getHeader(USER_ID_HEADER));
            if (id != null) return id;
        }

        throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED");
    }

    private static Long parseOrNull(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
