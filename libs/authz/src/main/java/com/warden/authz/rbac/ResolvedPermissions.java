package com.warden.authz.rbac;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattened effective permissions of one user. Derived on demand and cached, never persisted.
 *
 * @param userId           user the permissions belong to
 * @param tenantId         user's tenant
 * @param permissions      every permission granted by any non-expired assignment
 * @param permissionsByOrg the same permissions grouped by the assignment's organization
 * @param admin            whether any resolved role is an admin role
 * @param maxPriority      highest priority among directly assigned roles, 0 when there are none
 * @param resolvedRoleIds  ids of all contributing roles, inherited ones included
 */
public record ResolvedPermissions(
        String userId,
        String tenantId,
        Set<String> permissions,
        Map<String, Set<String>> permissionsByOrg,
        boolean admin,
        int maxPriority,
        List<String> resolvedRoleIds) {

    public ResolvedPermissions {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        Map<String, Set<String>> byOrg = new LinkedHashMap<>();
        if (permissionsByOrg != null) {
            permissionsByOrg.forEach((org, perms) -> byOrg.put(org, Set.copyOf(perms)));
        }
        permissionsByOrg = Map.copyOf(byOrg);
        resolvedRoleIds = resolvedRoleIds == null ? List.of() : List.copyOf(resolvedRoleIds);
    }

    /** Permissions granted inside {@code organizationId}; empty when there are none or the id is null. */
    public Set<String> permissionsIn(String organizationId) {
        return organizationId == null ? Set.of() : permissionsByOrg.getOrDefault(organizationId, Set.of());
    }
}
