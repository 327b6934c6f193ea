package com.warden.authz.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The resource being accessed. {@code type} and {@code tenantId} are mandatory because the
 * tenant isolation policy depends on them.
 *
 * @param type           resource type, e.g. {@code lease}
 * @param id             resource id, null for collection-level actions
 * @param tenantId       owning tenant
 * @param organizationId owning organization, null for tenant-wide resources
 * @param ownerId        owning user, if any
 * @param metadata       free-form attributes
 */
public record ResourceAttributes(
        String type,
        String id,
        String tenantId,
        String organizationId,
        String ownerId,
        Map<String, Object> metadata) implements TenantScoped {

    public ResourceAttributes {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        metadata = metadata == null ? Map.of() : metadata;
    }

    public Map<String, Object> toAttributeMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        AttributeMaps.putIfNotNull(map, "id", id);
        map.put("tenantId", tenantId);
        AttributeMaps.putIfNotNull(map, "organizationId", organizationId);
        AttributeMaps.putIfNotNull(map, "ownerId", ownerId);
        map.put("metadata", metadata);
        return map;
    }
}
