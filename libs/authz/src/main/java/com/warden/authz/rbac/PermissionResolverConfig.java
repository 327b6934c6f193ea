package com.warden.authz.rbac;

import java.time.Duration;

/**
 * Tuning for {@link PermissionResolver}.
 *
 * @param cacheTtl            how long resolved permissions stay cached
 * @param maxInheritanceDepth how many inheritance levels below a directly assigned role are followed
 */
public record PermissionResolverConfig(Duration cacheTtl, int maxInheritanceDepth) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_INHERITANCE_DEPTH = 5;

    public PermissionResolverConfig {
        cacheTtl = cacheTtl == null ? DEFAULT_CACHE_TTL : cacheTtl;
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be positive");
        }
        if (maxInheritanceDepth < 0) {
            throw new IllegalArgumentException("maxInheritanceDepth must not be negative");
        }
    }

    public static PermissionResolverConfig defaults() {
        return new PermissionResolverConfig(DEFAULT_CACHE_TTL, DEFAULT_MAX_INHERITANCE_DEPTH);
    }
}
