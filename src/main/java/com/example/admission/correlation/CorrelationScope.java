package com.example.admission.correlation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Binds a {@link CorrelationContext} to the current thread and the SLF4J MDC until closed.
 * Use with try-with-resources so the binding is removed on every exit path.
 */
public final class CorrelationScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CorrelationScope.class);

    private final CorrelationContext context;
    private final CorrelationContext previous;
    private final Thread owner;
    private boolean closed;

    CorrelationScope(CorrelationContext context, CorrelationContext previous) {
        this.context = context;
        this.previous = previous;
        this.owner = Thread.currentThread();
        CorrelationContext.bind(context);
        MDC.put(CorrelationContext.MDC_KEY, context.getCorrelationId());
        log.debug("Operation {} started (parent={})", context.getOperation(), context.getParentId());
    }

    public CorrelationContext context() {
        return context;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (Thread.currentThread() != owner) {
            log.warn("Correlation scope {} closed from foreign thread {}; binding on {} left untouched",
                    context.getCorrelationId(), Thread.currentThread().getName(), owner.getName());
            return;
        }
        log.debug("Operation {} finished in {} ms", context.getOperation(),
                Duration.between(context.getStartedAt(), Instant.now()).toMillis());
        CorrelationContext.bind(previous);
        if (previous != null) {
            MDC.put(CorrelationContext.MDC_KEY, previous.getCorrelationId());
        } else {
            MDC.remove(CorrelationContext.MDC_KEY);
        }
    }
}
