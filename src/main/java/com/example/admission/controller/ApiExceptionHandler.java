package com.example.admission.controller;

import com.example.admission.exception.AdmissionException;
import com.example.admission.exception.CircuitOpenException;
import com.example.admission.exception.QuotaExceededException;
import com.example.admission.exception.RateLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates admission failures into HTTP semantics for the operator API.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(IllegalArgumentException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "INVALID_REQUEST");
        body.put("message", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<Map<String, Object>> quotaExceeded(QuotaExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body(ex));
    }

    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<Map<String, Object>> rateLimited(RateLimitException ex) {
        long seconds = Math.max(1, (ex.getRetryAfter().toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                .body(body(ex));
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<Map<String, Object>> circuitOpen(CircuitOpenException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body(ex));
    }

    @ExceptionHandler(AdmissionException.class)
    public ResponseEntity<Map<String, Object>> admissionFailure(AdmissionException ex) {
        log.error("Admission failure {} (correlationId={})", ex.getErrorCode(), ex.getCorrelationId(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body(ex));
    }

    private static Map<String, Object> body(AdmissionException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getErrorCode());
        body.put("message", ex.getMessage());
        if (ex.getCorrelationId() != null) {
            body.put("correlationId", ex.getCorrelationId());
        }
        body.put("context", stringify(ex.getContext()));
        return body;
    }

    private static Map<String, String> stringify(Map<String, Object> context) {
        Map<String, String> result = new LinkedHashMap<>();
        context.forEach((key, value) -> result.put(key, String.valueOf(value)));
        return result;
    }
}
