package com.warden.authz.model;

import java.time.Instant;

/**
 * Assignment of a role to a user inside one organization.
 *
 * @param roleId         assigned role
 * @param organizationId organization the assignment is scoped to
 * @param assignedAt     when the assignment was made
 * @param assignedBy     user id of the assigner, may be null for system assignments
 * @param expiresAt      optional expiry; null means the assignment never expires
 */
public record UserRoleAssignment(
        String roleId,
        String organizationId,
        Instant assignedAt,
        String assignedBy,
        Instant expiresAt) {

    public UserRoleAssignment {
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("roleId must not be null or blank");
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
    }

    public static UserRoleAssignment permanent(String roleId, String organizationId) {
        return new UserRoleAssignment(roleId, organizationId, null, null, null);
    }

    /** True iff the assignment has an expiry strictly before {@code now}. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
