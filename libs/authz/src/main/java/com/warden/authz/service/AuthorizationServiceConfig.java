package com.warden.authz.service;

/**
 * How {@link AuthorizationService} combines its checks.
 *
 * @param enableAbac   evaluate policies in addition to the RBAC permission check
 * @param requireBoth  with ABAC enabled, require both checks to allow; otherwise either is enough
 * @param auditEnabled hand every decision to the audit sink
 */
public record AuthorizationServiceConfig(boolean enableAbac, boolean requireBoth, boolean auditEnabled) {

    public static AuthorizationServiceConfig defaults() {
        return new AuthorizationServiceConfig(true, true, true);
    }

    public static AuthorizationServiceConfig rbacOnly() {
        return new AuthorizationServiceConfig(false, true, true);
    }
}
