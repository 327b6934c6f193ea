package com.warden.authz.rbac;

import com.warden.authz.model.Role;

import java.util.Collection;
import java.util.List;

/**
 * Read access to tenant roles. Implemented by the host application.
 */
public interface RoleStore {

    /**
     * Fetches roles by id in one call.
     * <p>
     * Results may come back in any order. Ids that do not exist are simply absent from the result.
     * Implementations signal I/O failure by throwing any {@link RuntimeException}.
     *
     * @param roleIds  ids to fetch
     * @param tenantId tenant the roles belong to
     * @return the roles that exist
     */
    List<Role> getRolesByIds(Collection<String> roleIds, String tenantId);
}
