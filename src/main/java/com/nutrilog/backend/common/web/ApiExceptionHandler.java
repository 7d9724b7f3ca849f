package com.nutrilog.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.DateTimeException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain error codes to HTTP status. Codes travel as exception messages (UPPER_SNAKE).
 * <ul>
 *   <li>400: bad input, unknown time zone, validation</li>
 *   <li>401: no caller id</li>
 *   <li>404: {@code *_NOT_FOUND}</li>
 *   <li>409: state conflicts such as {@code PREDICTION_NOT_AVAILABLE}</li>
 *   <li>500: anything else</li>
 * </ul>
 * Body: {@code {code, message?, requestId}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DateTimeException.class)
    public ResponseEntity<Map<String, Object>> handleDateTime(DateTimeException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest req) {
        String code = code(ex, "BAD_REQUEST");
        HttpStatus status = code.endsWith("_NOT_FOUND") ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(err(code, null, req));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex, HttpServletRequest req) {
        String code = code(ex, "ILLEGAL_STATE");
        HttpStatus status = switch (code) {
            case "PREDICTION_NOT_AVAILABLE" -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("illegal_state code={} {} {}", code, req.getMethod(), req.getRequestURI(), ex);
        }
        return ResponseEntity.status(status).body(err(code, null, req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        String code = (ex.getReason() == null || ex.getReason().isBlank())
                ? ex.getStatusCode().toString()
                : ex.getReason();
        return ResponseEntity.status(ex.getStatusCode()).body(err(code, null, req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled {} {} failed", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", null, req));
    }

    private static String code(RuntimeException ex, String fallback) {
        String m = ex.getMessage();
        return (m == null || m.isBlank()) ? fallback : m.trim();
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", RequestIdFilter.getOrCreate(req));
        return m;
    }
}
