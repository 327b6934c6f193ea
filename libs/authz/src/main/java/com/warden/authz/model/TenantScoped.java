package com.warden.authz.model;

/**
 * Anything that belongs to exactly one tenant.
 */
public interface TenantScoped {

    String tenantId();
}
