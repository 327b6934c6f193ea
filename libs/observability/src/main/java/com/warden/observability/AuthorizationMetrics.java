package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters for authorization decisions.
 * <p>
 * Every meter carries a {@code service} tag. Decision meters are additionally tagged with
 * the {@code tenant} so that deny spikes can be segmented per tenant on dashboards.
 * <p>
 * Meter names:
 * <ul>
 *   <li>{@value #DECISIONS}: counter, tagged {@code outcome=allow|deny}</li>
 *   <li>{@value #EVALUATION}: timer of a full decision (store round trips included)</li>
 *   <li>{@value #PERMISSION_CACHE}: counter, tagged {@code result=hit|miss}</li>
 *   <li>{@value #STORE_FAILURES}: counter, tagged {@code store=role|policy}</li>
 * </ul>
 */
public final class AuthorizationMetrics {

    public static final String DECISIONS = "warden.authz.decisions";
    public static final String EVALUATION = "warden.authz.evaluation";
    public static final String PERMISSION_CACHE = "warden.authz.permission.cache";
    public static final String STORE_FAILURES = "warden.authz.store.failures";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_TENANT = "tenant";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_RESULT = "result";
    public static final String TAG_STORE = "store";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer registry meters are registered with
     * @param serviceName logical service name added to every meter
     */
    public AuthorizationMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Records one decision: increments the outcome counter and the evaluation timer.
     *
     * @param tenantId tenant of the subject ({@code unknown} when null)
     * @param allowed  the final outcome
     * @param elapsed  wall-clock time spent producing the decision
     */
    public void recordDecision(String tenantId, boolean allowed, Duration elapsed) {
        Tags tags = baseTags().and(TAG_TENANT, tenantOrUnknown(tenantId));
        Counter.builder(DECISIONS)
                .description("Authorization decisions by outcome")
                .tags(tags.and(TAG_OUTCOME, allowed ? "allow" : "deny"))
                .register(registry)
                .increment();
        Timer.builder(EVALUATION)
                .description("Time spent producing an authorization decision")
                .tags(tags)
                .register(registry)
                .record(elapsed);
    }

    /** Counts a permission cache lookup. */
    public void recordCacheLookup(boolean hit) {
        Counter.builder(PERMISSION_CACHE)
                .description("Resolved-permission cache lookups")
                .tags(baseTags().and(TAG_RESULT, hit ? "hit" : "miss"))
                .register(registry)
                .increment();
    }

    /**
     * Counts a failed call to a backing store.
     *
     * @param store lower-case store name, e.g. {@code role} or {@code policy}
     */
    public void recordStoreFailure(String store) {
        Counter.builder(STORE_FAILURES)
                .description("Failed role/policy store calls")
                .tags(baseTags().and(TAG_STORE, store))
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }

    private static String tenantOrUnknown(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? "unknown" : tenantId;
    }
}
