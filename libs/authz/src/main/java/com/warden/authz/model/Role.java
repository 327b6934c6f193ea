package com.warden.authz.model;

import java.util.List;

/**
 * A tenant-scoped role.
 * <p>
 * Roles are immutable; an update replaces the record. {@code inheritsFrom} is expected to form
 * a DAG, but readers must tolerate cycles.
 *
 * @param id           role id
 * @param tenantId     owning tenant
 * @param name         display name
 * @param permissions  permission strings in declaration order, e.g. {@code unit:read}
 * @param inheritsFrom ids of roles whose permissions this role also grants
 * @param priority     numeric priority, higher is stronger
 * @param admin        whether holders are tenant administrators
 */
public record Role(
        String id,
        String tenantId,
        String name,
        List<String> permissions,
        List<String> inheritsFrom,
        int priority,
        boolean admin) implements TenantScoped {

    public Role {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        name = name == null ? id : name;
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        inheritsFrom = inheritsFrom == null ? List.of() : List.copyOf(inheritsFrom);
    }
}
