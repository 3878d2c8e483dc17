package com.example.admission.correlation;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identifier and metadata carried through one top-level operation for log correlation.
 * <p>
 * A context is bound to the current thread only while a {@link CorrelationScope} is open;
 * scopes nest, and closing a child restores its parent.
 */
public final class CorrelationContext {

    public static final String MDC_KEY = "correlationId";

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private final String correlationId;
    private final String parentId;
    private final String operation;
    private final Instant startedAt;
    private final Map<String, String> metadata = new ConcurrentHashMap<>();

    CorrelationContext(String correlationId, String parentId, String operation, Instant startedAt) {
        this.correlationId = correlationId;
        this.parentId = parentId;
        this.operation = operation;
        this.startedAt = startedAt;
    }

    /**
     * Opens a scope with a freshly generated correlation id.
     */
    public static CorrelationScope open(String operation) {
        return open(operation, null);
    }

    /**
     * Opens a scope for {@code operation}. A {@code null} id generates a new one.
     */
    public static CorrelationScope open(String operation, String correlationId) {
        CorrelationContext parent = CURRENT.get();
        String id = correlationId != null ? correlationId : generateId();
        CorrelationContext context = new CorrelationContext(
                id,
                parent != null ? parent.getCorrelationId() : null,
                operation,
                Instant.now()
        );
        return new CorrelationScope(context, parent);
    }

    public static Optional<CorrelationContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static Optional<String> currentId() {
        return current().map(CorrelationContext::getCorrelationId);
    }

    public static String generateId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    static void bind(CorrelationContext context) {
        if (context == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(context);
        }
    }

    public CorrelationContext put(String key, Object value) {
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * @return id of the enclosing context when this one was opened inside another scope, else null
     */
    public String getParentId() {
        return parentId;
    }

    public String getOperation() {
        return operation;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    @Override
    public String toString() {
        return "CorrelationContext{" +
                "correlationId='" + correlationId + '\'' +
                ", operation='" + operation + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
