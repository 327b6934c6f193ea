package com.warden.authz.service;

import com.warden.authz.policy.AuthorizationDecision;

/**
 * Combined outcome of the RBAC and ABAC checks.
 *
 * @param allowed      final outcome
 * @param source       which check(s) decided
 * @param rbac         RBAC check result
 * @param abacDecision policy decision; only the system policies are evaluated when ABAC is disabled
 * @param reason       internal reason, not for end users
 */
public record AuthorizationResult(
        boolean allowed,
        Source source,
        RbacResult rbac,
        AuthorizationDecision abacDecision,
        String reason) {

    public enum Source {
        RBAC,
        ABAC,
        BOTH
    }

    /**
     * @param allowed            whether the permission was held
     * @param checkedPermission  the permission checked, {@code resourceType:action}
     */
    public record RbacResult(boolean allowed, String checkedPermission) {
    }

    public String publicMessage() {
        return allowed ? "Authorized" : AuthorizationDecision.NOT_AUTHORIZED;
    }
}
