package com.warden.authz.rbac;

import com.warden.authz.model.Role;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RoleStore} backed by a concurrent map. Used in tests and for static role catalogs.
 */
public class InMemoryRoleStore implements RoleStore {

    private final Map<String, Role> roles = new ConcurrentHashMap<>();

    public InMemoryRoleStore save(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        roles.put(key(role.tenantId(), role.id()), role);
        return this;
    }

    public void remove(String tenantId, String roleId) {
        roles.remove(key(tenantId, roleId));
    }

    @Override
    public List<Role> getRolesByIds(Collection<String> roleIds, String tenantId) {
        List<Role> found = new ArrayList<>();
        for (String roleId : roleIds) {
            Role role = roles.get(key(tenantId, roleId));
            if (role != null) {
                found.add(role);
            }
        }
        return found;
    }

    private static String key(String tenantId, String roleId) {
        return tenantId + ":" + roleId;
    }
}
