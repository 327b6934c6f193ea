package com.warden.authz.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes of the principal making the request.
 *
 * @param userId          principal id
 * @param tenantId        principal's tenant
 * @param userType        account type
 * @param roleIds         ids of roles held through non-expired assignments
 * @param organizationIds organizations the principal belongs to
 * @param permissions     resolved permission strings
 * @param mfaVerified     whether MFA was completed
 * @param metadata        free-form attributes, addressable as {@code metadata.<key>}
 */
public record SubjectAttributes(
        String userId,
        String tenantId,
        String userType,
        List<String> roleIds,
        List<String> organizationIds,
        List<String> permissions,
        boolean mfaVerified,
        Map<String, Object> metadata) {

    public SubjectAttributes {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        roleIds = roleIds == null ? List.of() : List.copyOf(roleIds);
        organizationIds = organizationIds == null ? List.of() : List.copyOf(organizationIds);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public Map<String, Object> toAttributeMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("userId", userId);
        map.put("tenantId", tenantId);
        AttributeMaps.putIfNotNull(map, "userType", userType);
        map.put("roleIds", roleIds);
        map.put("organizationIds", organizationIds);
        map.put("permissions", permissions);
        map.put("mfaVerified", mfaVerified);
        map.put("metadata", metadata);
        return map;
    }
}
