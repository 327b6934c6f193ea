package com.warden.authz.model;

import java.util.List;

/**
 * The parts of a user account the engine reads.
 *
 * @param id                    user id
 * @param tenantId              tenant the user belongs to
 * @param userType              account type, e.g. {@code STAFF} or {@code CUSTOMER}
 * @param primaryOrganizationId home organization, may be null
 * @param roleAssignments       role assignments, expired ones included
 * @param mfaVerified           whether the current session passed MFA
 */
public record User(
        String id,
        String tenantId,
        String userType,
        String primaryOrganizationId,
        List<UserRoleAssignment> roleAssignments,
        boolean mfaVerified) {

    public static final String TYPE_CUSTOMER = "CUSTOMER";

    public User {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        roleAssignments = roleAssignments == null ? List.of() : List.copyOf(roleAssignments);
    }
}
