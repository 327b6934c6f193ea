package com.warden.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for authorization work.
 * <p>
 * Attributes of the current {@link DecisionLogContext} (tenant, user, request) are copied
 * onto every span. The SDK itself (exporter, sampler) is configured by the host application.
 */
public final class AuthorizationTracer {

    /** Span attribute carrying the final outcome of a decision span. */
    public static final String ATTR_ALLOWED = "authz.allowed";

    private final Tracer tracer;

    public AuthorizationTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new INTERNAL span.
     *
     * @param spanName   span name
     * @param attributes extra string attributes set before the span starts
     * @param work       the work to run
     * @param <T>        result type
     * @return the result of {@code work}
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        return inSpan(spanName, attributes, work, null);
    }

    /**
     * Runs {@code work} inside a new INTERNAL span and tags the span with
     * {@value #ATTR_ALLOWED} using {@code outcome} applied to the result.
     * Exceptions are recorded on the span, which is marked ERROR, and rethrown.
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work,
                        Predicate<T> outcome) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        DecisionLogContextHolder.get().ifPresent(ctx -> {
            setIfPresent(span, "tenant.id", ctx.tenantId());
            setIfPresent(span, "user.id", ctx.userId());
            setIfPresent(span, "request.id", ctx.requestId());
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            if (outcome != null) {
                span.setAttribute(ATTR_ALLOWED, outcome.test(result));
            }
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }

    private static void setIfPresent(Span span, String key, String value) {
        if (value != null) {
            span.setAttribute(key, value);
        }
    }
}
