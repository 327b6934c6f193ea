package com.warden.authz.policy;

import java.util.List;

/**
 * Read access to tenant-authored policies. Implemented by the host application.
 */
public interface PolicyStore {

    /**
     * Returns the tenant's active, non-deleted policies in insertion order. I/O failure is
     * signalled by throwing any {@link RuntimeException}.
     */
    List<Policy> getActivePolicies(String tenantId);
}
