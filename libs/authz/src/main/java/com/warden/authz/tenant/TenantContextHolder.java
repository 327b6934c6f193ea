package com.warden.authz.tenant;

import com.warden.observability.DecisionLogContext;
import com.warden.observability.DecisionLogContextHolder;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for the current {@link TenantContext}.
 * <p>
 * The tenant and user ids are mirrored into {@link DecisionLogContextHolder}, so log lines
 * written inside the scope carry them. Request and session ids already in place are kept.
 */
public final class TenantContextHolder {

    private static final ThreadLocal<TenantContext> CONTEXT = new ThreadLocal<>();

    private TenantContextHolder() {
        // utility class
    }

    public static Optional<TenantContext> current() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * @throws IllegalStateException outside {@link #callWithTenantContext}
     */
    public static TenantContext require() {
        TenantContext context = CONTEXT.get();
        if (context == null) {
            throw new IllegalStateException(
                    "No tenant context available; run the operation inside callWithTenantContext");
        }
        return context;
    }

    /**
     * Runs {@code work} scoped to {@code context}, then restores whatever was there before.
     */
    public static <T> T callWithTenantContext(TenantContext context, Supplier<T> work) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        DecisionLogContext logContext = DecisionLogContextHolder.get()
                .map(c -> new DecisionLogContext(context.tenantId(), userId(context, c), c.requestId(), c.sessionId()))
                .orElseGet(() -> new DecisionLogContext(context.tenantId(), context.userId(), null, null));

        TenantContext previous = CONTEXT.get();
        CONTEXT.set(context);
        try {
            return DecisionLogContextHolder.callWithContext(logContext, work);
        } finally {
            if (previous != null) {
                CONTEXT.set(previous);
            } else {
                CONTEXT.remove();
            }
        }
    }

    public static void runWithTenantContext(TenantContext context, Runnable work) {
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        callWithTenantContext(context, () -> {
            work.run();
            return null;
        });
    }

    private static String userId(TenantContext context, DecisionLogContext existing) {
        return context.userId() != null ? context.userId() : existing.userId();
    }
}
