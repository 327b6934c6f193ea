package com.warden.authz.rbac;

import java.time.Duration;
import java.util.Optional;

/**
 * Pluggable store for resolved permissions. Any implementation (local map, distributed cache)
 * works as long as an entry is never returned after its TTL and {@link #delete} takes effect
 * for subsequent reads on the same node.
 */
public interface PermissionCache {

    Optional<ResolvedPermissions> get(String key);

    void set(String key, ResolvedPermissions value, Duration ttl);

    void delete(String key);
}
