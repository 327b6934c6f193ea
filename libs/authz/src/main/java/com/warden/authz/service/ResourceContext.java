package com.warden.authz.service;

import java.util.Map;

/**
 * The resource a caller wants to act on.
 *
 * @param type           resource type
 * @param id             resource id, may be null
 * @param tenantId       tenant that owns the resource; null means the caller's own tenant
 * @param organizationId owning organization, may be null
 * @param ownerId        owning user, may be null
 * @param metadata       extra attributes for policy conditions
 */
public record ResourceContext(
        String type,
        String id,
        String tenantId,
        String organizationId,
        String ownerId,
        Map<String, Object> metadata) {

    public ResourceContext {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static ResourceContext of(String type, String id) {
        return new ResourceContext(type, id, null, null, null, null);
    }

    public ResourceContext inTenant(String newTenantId) {
        return new ResourceContext(type, id, newTenantId, organizationId, ownerId, metadata);
    }

    public ResourceContext inOrganization(String newOrganizationId) {
        return new ResourceContext(type, id, tenantId, newOrganizationId, ownerId, metadata);
    }

    public ResourceContext ownedBy(String newOwnerId) {
        return new ResourceContext(type, id, tenantId, organizationId, newOwnerId, metadata);
    }
}
