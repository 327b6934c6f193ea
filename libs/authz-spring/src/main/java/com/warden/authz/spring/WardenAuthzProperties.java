package com.warden.authz.spring;

import com.warden.authz.rbac.PermissionResolverConfig;
import com.warden.authz.service.AuthorizationServiceConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Engine settings bound from {@code warden.authz.*}.
 *
 * <pre>
 * warden:
 *   authz:
 *     service-name: lease-service
 *     cache-ttl: 60s
 *     max-inheritance-depth: 5
 *     enable-abac: true
 *     require-both: true
 *     audit-enabled: true
 *     policy-location: classpath:authz/policies.json
 * </pre>
 *
 * @param serviceName         value of the {@code service} tag on every meter
 * @param cacheTtl            resolved-permission cache TTL (default 60s)
 * @param maxInheritanceDepth role inheritance levels followed (default 5)
 * @param enableAbac          evaluate policies (default true)
 * @param requireBoth         require RBAC and ABAC to both allow (default true)
 * @param auditEnabled        write audit events (default true)
 * @param policyLocation      Spring resource with a JSON policy document; used only when the
 *                            application defines no {@code PolicyStore} of its own
 */
@ConfigurationProperties(prefix = "warden.authz")
@Validated
public record WardenAuthzProperties(
        @NotBlank String serviceName,
        Duration cacheTtl,
        @Max(32) int maxInheritanceDepth,
        Boolean enableAbac,
        Boolean requireBoth,
        Boolean auditEnabled,
        String policyLocation) {

    public static final String DEFAULT_SERVICE_NAME = "warden-authz";

    /** Fills in defaults; runs before Bean Validation. */
    public WardenAuthzProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
        if (cacheTtl == null) {
            cacheTtl = PermissionResolverConfig.DEFAULT_CACHE_TTL;
        }
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("warden.authz.cache-ttl must be positive");
        }
        if (maxInheritanceDepth <= 0) {
            maxInheritanceDepth = PermissionResolverConfig.DEFAULT_MAX_INHERITANCE_DEPTH;
        }
        enableAbac = enableAbac == null ? Boolean.TRUE : enableAbac;
        requireBoth = requireBoth == null ? Boolean.TRUE : requireBoth;
        auditEnabled = auditEnabled == null ? Boolean.TRUE : auditEnabled;
        if (policyLocation != null && policyLocation.isBlank()) {
            policyLocation = null;
        }
    }

    public static WardenAuthzProperties defaults() {
        return new WardenAuthzProperties(null, null, 0, null, null, null, null);
    }

    public PermissionResolverConfig resolverConfig() {
        return new PermissionResolverConfig(cacheTtl, maxInheritanceDepth);
    }

    public AuthorizationServiceConfig serviceConfig() {
        return new AuthorizationServiceConfig(enableAbac, requireBoth, auditEnabled);
    }
}
