package com.warden.authz.tenant;

import com.warden.authz.model.TenantScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Keeps data access inside one tenant.
 * <p>
 * The assertions throw {@link TenantMismatchException}; the filters drop foreign entities and
 * log them at WARN. A super-admin context passes everything through.
 */
public class TenantIsolationEnforcer {

    private static final Logger log = LoggerFactory.getLogger(TenantIsolationEnforcer.class);

    /** Default column used by {@link TenantScopedQuery}. */
    public static final String TENANT_COLUMN = "tenant_id";

    private final TenantContext context;

    public TenantIsolationEnforcer(TenantContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        this.context = context;
    }

    public static TenantIsolationEnforcer forTenant(String tenantId) {
        return new TenantIsolationEnforcer(TenantContext.of(tenantId));
    }

    /**
     * @throws IllegalStateException outside a tenant scope
     */
    public static TenantIsolationEnforcer forCurrentContext() {
        return new TenantIsolationEnforcer(TenantContextHolder.require());
    }

    public String tenantId() {
        return context.tenantId();
    }

    public boolean allowsCrossTenant() {
        return context.superAdmin();
    }

    /**
     * Returns {@code entity} if it belongs to the context tenant.
     *
     * @throws TenantMismatchException otherwise
     */
    public <T extends TenantScoped> T assertTenantMatch(T entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        assertTenantId(entity.tenantId());
        return entity;
    }

    /**
     * @throws TenantMismatchException if {@code tenantId} is not the context tenant
     */
    public void assertTenantId(String tenantId) {
        if (!matches(tenantId)) {
            throw new TenantMismatchException(context.tenantId(), tenantId);
        }
    }

    /** The entities of the context tenant, in their original order. */
    public <T extends TenantScoped> List<T> filter(Collection<? extends T> entities) {
        List<T> kept = new ArrayList<>();
        if (entities == null) {
            return kept;
        }
        for (T entity : entities) {
            if (entity == null) {
                continue;
            }
            if (matches(entity.tenantId())) {
                kept.add(entity);
            } else {
                log.warn("Dropping {} of tenant {} outside tenant {}",
                        entity.getClass().getSimpleName(), entity.tenantId(), context.tenantId());
            }
        }
        return kept;
    }

    /** Empty when {@code entity} is null or belongs to another tenant. */
    public <T extends TenantScoped> Optional<T> validate(T entity) {
        if (entity == null || !matches(entity.tenantId())) {
            return Optional.empty();
        }
        return Optional.of(entity);
    }

    /** A copy of {@code criteria} with the context tenant added under {@code tenantId}. */
    public Map<String, Object> scopeCriteria(Map<String, ?> criteria) {
        Map<String, Object> scoped = new LinkedHashMap<>();
        if (criteria != null) {
            scoped.putAll(criteria);
        }
        scoped.put("tenantId", context.tenantId());
        return scoped;
    }

    /** Wraps a single-entity lookup so that foreign results come back empty. */
    public <A, T extends TenantScoped> Function<A, Optional<T>> scoped(Function<A, T> lookup) {
        return argument -> validate(lookup.apply(argument));
    }

    /** Wraps a multi-entity lookup so that foreign results are dropped. */
    public <A, T extends TenantScoped> Function<A, List<T>> scopedAll(
            Function<A, ? extends Collection<? extends T>> lookup) {
        return argument -> filter(lookup.apply(argument));
    }

    /** {@code tenant_id = $1} bound to the context tenant. */
    public TenantScopedQuery whereClause() {
        return TenantScopedQuery.where(TENANT_COLUMN, 1, context.tenantId());
    }

    /** Appends the tenant predicate to an existing WHERE clause and its positional parameters. */
    public TenantScopedQuery appendTenantFilter(String existingWhere, List<?> existingParams) {
        return TenantScopedQuery.append(existingWhere, existingParams, TENANT_COLUMN, context.tenantId());
    }

    private boolean matches(String tenantId) {
        return context.superAdmin() || context.tenantId().equals(tenantId);
    }
}
