package com.warden.authz.tenant;

import com.warden.authz.model.User;

/**
 * Tenant scope of the work running on the current thread.
 *
 * @param tenantId   tenant the work is scoped to
 * @param userId     acting user, may be null for system work
 * @param superAdmin whether cross-tenant access is permitted
 */
public record TenantContext(String tenantId, String userId, boolean superAdmin) {

    /** User type allowed to cross tenant boundaries. */
    public static final String SUPER_ADMIN_USER_TYPE = "INTERNAL_ADMIN";

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }

    public static TenantContext of(String tenantId) {
        return new TenantContext(tenantId, null, false);
    }

    public static TenantContext forUser(User user) {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
        return new TenantContext(user.tenantId(), user.id(), SUPER_ADMIN_USER_TYPE.equals(user.userType()));
    }
}
