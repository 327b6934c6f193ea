package com.warden.authz.tenant;

/**
 * Thrown when code running for one tenant touches an entity or id of another.
 */
public class TenantMismatchException extends RuntimeException {

    private final String expectedTenantId;
    private final String actualTenantId;

    public TenantMismatchException(String expectedTenantId, String actualTenantId) {
        super(actualTenantId == null
                ? "Tenant mismatch: entity does not belong to tenant '%s'".formatted(expectedTenantId)
                : "Tenant mismatch: context tenant '%s' cannot access data of tenant '%s'"
                        .formatted(expectedTenantId, actualTenantId));
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    public String expectedTenantId() {
        return expectedTenantId;
    }

    /** Tenant of the offending entity; null when it declared none. */
    public String actualTenantId() {
        return actualTenantId;
    }
}
