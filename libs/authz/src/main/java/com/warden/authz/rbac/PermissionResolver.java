package com.warden.authz.rbac;

import com.warden.authz.StoreUnavailableException;
import com.warden.authz.model.Role;
import com.warden.authz.model.User;
import com.warden.authz.model.UserRoleAssignment;
import com.warden.authz.tenant.TenantIsolationEnforcer;
import com.warden.observability.AuthorizationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes a user's effective permissions from role assignments and role inheritance.
 * <p>
 * Roles are fetched breadth-first, one {@link RoleStore} call per inheritance level, and kept
 * in a visited map so that cyclic inheritance terminates. Results are cached per
 * {@code tenant:user} for {@link PermissionResolverConfig#cacheTtl()}.
 * <p>
 * Thread-safe as long as the store and cache are.
 */
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final RoleStore roleStore;
    private final PermissionCache cache;
    private final PermissionResolverConfig config;
    private final Clock clock;
    private final AuthorizationMetrics metrics;

    public PermissionResolver(RoleStore roleStore, PermissionCache cache) {
        this(roleStore, cache, PermissionResolverConfig.defaults(), Clock.systemUTC(), null);
    }

    /**
     * @param metrics optional; when null, cache and store metrics are not recorded
     */
    public PermissionResolver(RoleStore roleStore, PermissionCache cache, PermissionResolverConfig config,
                              Clock clock, AuthorizationMetrics metrics) {
        if (roleStore == null) {
            throw new IllegalArgumentException("roleStore must not be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache must not be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.roleStore = roleStore;
        this.cache = cache;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Returns the user's effective permissions, from cache when fresh.
     *
     * @throws StoreUnavailableException if the role store fails
     */
    public ResolvedPermissions resolvePermissions(User user) {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
        String key = cacheKey(user.tenantId(), user.id());
        // ids may contain ':', so a hit must belong to this user
        Optional<ResolvedPermissions> cached = cache.get(key)
                .filter(p -> user.id().equals(p.userId()) && user.tenantId().equals(p.tenantId()));
        if (metrics != null) {
            metrics.recordCacheLookup(cached.isPresent());
        }
        if (cached.isPresent()) {
            return cached.get();
        }
        ResolvedPermissions resolved = computePermissions(user);
        cache.set(key, resolved, config.cacheTtl());
        log.debug("Resolved {} permissions from {} roles for user {}",
                resolved.permissions().size(), resolved.resolvedRoleIds().size(), user.id());
        return resolved;
    }

    /** True if any effective permission of the user matches {@code required}. */
    public boolean hasPermission(User user, String required) {
        return PermissionMatcher.anyMatches(resolvePermissions(user).permissions(), required);
    }

    /**
     * Checks the global permission set first, then the set granted inside {@code organizationId}.
     */
    public boolean hasPermissionInOrg(User user, String required, String organizationId) {
        ResolvedPermissions resolved = resolvePermissions(user);
        if (PermissionMatcher.anyMatches(resolved.permissions(), required)) {
            return true;
        }
        return PermissionMatcher.anyMatches(resolved.permissionsIn(organizationId), required);
    }

    /** Drops the cached entry so that the next resolution recomputes from the store. */
    public void invalidateUser(String userId, String tenantId) {
        cache.delete(cacheKey(tenantId, userId));
        log.debug("Invalidated cached permissions for user {} in tenant {}", userId, tenantId);
    }

    static String cacheKey(String tenantId, String userId) {
        return tenantId + ":" + userId;
    }

    private ResolvedPermissions computePermissions(User user) {
        Instant now = clock.instant();
        List<UserRoleAssignment> active = new ArrayList<>();
        for (UserRoleAssignment assignment : user.roleAssignments()) {
            if (assignment.isExpiredAt(now)) {
                log.debug("Skipping expired assignment of role {} for user {}", assignment.roleId(), user.id());
            } else {
                active.add(assignment);
            }
        }

        Set<String> directIds = new LinkedHashSet<>();
        active.forEach(a -> directIds.add(a.roleId()));
        Map<String, Role> roles = fetchWithInheritance(directIds, user.tenantId());

        Set<String> permissions = new LinkedHashSet<>();
        Map<String, Set<String>> permissionsByOrg = new LinkedHashMap<>();
        Set<String> resolvedRoleIds = new LinkedHashSet<>();
        boolean admin = false;
        int maxPriority = 0;

        for (UserRoleAssignment assignment : active) {
            Role direct = roles.get(assignment.roleId());
            if (direct == null) {
                log.debug("Role {} assigned to user {} no longer exists", assignment.roleId(), user.id());
                continue;
            }
            maxPriority = Math.max(maxPriority, direct.priority());
            Set<String> orgPermissions = permissionsByOrg.computeIfAbsent(
                    assignment.organizationId(), org -> new LinkedHashSet<>());
            for (Role role : closure(direct, roles)) {
                permissions.addAll(role.permissions());
                orgPermissions.addAll(role.permissions());
                resolvedRoleIds.add(role.id());
                admin |= role.admin();
            }
        }

        return new ResolvedPermissions(user.id(), user.tenantId(), permissions, permissionsByOrg,
                admin, maxPriority, new ArrayList<>(resolvedRoleIds));
    }

    /**
     * Breadth-first fetch of the directly assigned roles and everything they inherit, up to
     * {@code maxInheritanceDepth} levels below them.
     */
    private Map<String, Role> fetchWithInheritance(Set<String> directIds, String tenantId) {
        TenantIsolationEnforcer enforcer = TenantIsolationEnforcer.forTenant(tenantId);
        Map<String, Role> visited = new HashMap<>();
        Set<String> requested = new HashSet<>();
        Set<String> level = new LinkedHashSet<>(directIds);

        for (int depth = 0; depth <= config.maxInheritanceDepth() && !level.isEmpty(); depth++) {
            requested.addAll(level);
            Set<String> next = new LinkedHashSet<>();
            for (Role role : enforcer.filter(fetchRoles(level, tenantId))) {
                if (visited.putIfAbsent(role.id(), role) != null) {
                    continue;
                }
                for (String parent : role.inheritsFrom()) {
                    if (!requested.contains(parent)) {
                        next.add(parent);
                    }
                }
            }
            level = next;
        }
        if (!level.isEmpty()) {
            log.debug("Role inheritance truncated at depth {}; {} roles not followed",
                    config.maxInheritanceDepth(), level.size());
        }
        return visited;
    }

    /** The role plus every role it inherits within the depth bound, each once. */
    private List<Role> closure(Role root, Map<String, Role> roles) {
        List<Role> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<Role> queue = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        queue.add(root);
        depths.add(0);
        seen.add(root.id());

        while (!queue.isEmpty()) {
            Role role = queue.poll();
            int depth = depths.poll();
            result.add(role);
            if (depth >= config.maxInheritanceDepth()) {
                continue;
            }
            for (String parentId : role.inheritsFrom()) {
                Role parent = roles.get(parentId);
                if (parent != null && seen.add(parentId)) {
                    queue.add(parent);
                    depths.add(depth + 1);
                }
            }
        }
        return result;
    }

    private List<Role> fetchRoles(Set<String> roleIds, String tenantId) {
        try {
            List<Role> roles = roleStore.getRolesByIds(List.copyOf(roleIds), tenantId);
            return roles == null ? List.of() : roles;
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Role store failed for tenant {}: {}", tenantId, e.getMessage());
            if (metrics != null) {
                metrics.recordStoreFailure(StoreUnavailableException.Store.ROLE.tag());
            }
            throw new StoreUnavailableException(StoreUnavailableException.Store.ROLE, tenantId, e);
        }
    }
}
