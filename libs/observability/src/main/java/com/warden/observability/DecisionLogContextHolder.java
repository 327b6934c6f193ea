package com.warden.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link DecisionLogContext} bridged to the SLF4J MDC.
 * <p>
 * Decisions are synchronous per call, so the context is scoped with
 * {@link #callWithContext(DecisionLogContext, Supplier)}: the previous context (if any)
 * is restored when the work returns or throws.
 */
public final class DecisionLogContextHolder {

    private static final ThreadLocal<DecisionLogContext> CONTEXT = new ThreadLocal<>();

    private DecisionLogContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(DecisionLogContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(DecisionLogContext.MDC_TENANT_ID, context.tenantId());
        putOrRemove(DecisionLogContext.MDC_USER_ID, context.userId());
        putOrRemove(DecisionLogContext.MDC_REQUEST_ID, context.requestId());
        putOrRemove(DecisionLogContext.MDC_SESSION_ID, context.sessionId());
    }

    public static Optional<DecisionLogContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and its MDC keys from the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(DecisionLogContext.MDC_TENANT_ID);
        MDC.remove(DecisionLogContext.MDC_USER_ID);
        MDC.remove(DecisionLogContext.MDC_REQUEST_ID);
        MDC.remove(DecisionLogContext.MDC_SESSION_ID);
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores whatever was there before.
     */
    public static <T> T callWithContext(DecisionLogContext context, Supplier<T> work) {
        DecisionLogContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
