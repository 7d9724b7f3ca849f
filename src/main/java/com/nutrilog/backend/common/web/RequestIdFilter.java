package com.nutrilog.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Binds one request id to the request: attribute {@link #ATTR} for controllers and the exception handler,
 * MDC key {@link #MDC_KEY} for the log pattern (carried onto prediction fetch threads by
 * {@link MdcTaskDecorator}), and the {@link #HEADER} response header.
 *
 * <p>An inbound id is reused only when it is a plain token; anything else is replaced so it
 * cannot forge log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = accept(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);

        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, rid);
        try {
            chain.doFilter(req, res);
        } finally {
            if (previous == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, previous);
        }
    }

    /** The request's id; requests that skipped the filter get one minted and bound on first use. */
    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        if (v != null) return String.valueOf(v);

        String rid = newId();
        req.setAttribute(ATTR, rid);
        return rid;
    }

    static String accept(String inbound) {
        if (inbound == null) return newId();
        String t = inbound.trim();
        return ACCEPTED.matcher(t).matches() ? t : newId();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
