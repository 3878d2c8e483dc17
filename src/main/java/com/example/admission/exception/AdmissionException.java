package com.example.admission.exception;

import com.example.admission.correlation.CorrelationContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of every failure raised by the admission and resilience layer.
 * <p>
 * Captures the correlation id active when the exception was created, plus a structured
 * context map (environment, provider, attempted strategies) for diagnosis. Never put
 * credentials in the context.
 */
public class AdmissionException extends RuntimeException {

    private final String errorCode;
    private final String correlationId;
    private final Map<String, Object> context = new LinkedHashMap<>();

    public AdmissionException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public AdmissionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.correlationId = CorrelationContext.currentId().orElse(null);
    }

    public AdmissionException addContext(String key, Object value) {
        if (value != null) {
            context.put(key, value);
        }
        return this;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName())
                .append('[').append(errorCode).append("] ").append(getMessage());
        if (correlationId != null) {
            sb.append(" (correlationId=").append(correlationId).append(')');
        }
        if (!context.isEmpty()) {
            sb.append(' ').append(context);
        }
        return sb.toString();
    }
}
