package com.warden.authz.guard;

import com.warden.authz.condition.ConditionGroup;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What a guarded operation requires, declared once per operation.
 *
 * @param kind       requirement kind
 * @param resource   resource type, for {@link Kind#PERMISSION}
 * @param action     action, for {@link Kind#PERMISSION}
 * @param conditions extra conditions checked after a permission allow, may be null
 * @param roleMode   how {@code roleIds} combine, for {@link Kind#ROLES}
 * @param roleIds    required role ids, for {@link Kind#ROLES}
 */
public record GuardRequirement(
        Kind kind,
        String resource,
        String action,
        ConditionGroup conditions,
        RoleMode roleMode,
        Set<String> roleIds) {

    public enum Kind {
        PUBLIC,
        PERMISSION,
        ROLES
    }

    public enum RoleMode {
        ANY,
        ALL
    }

    private static final GuardRequirement PUBLIC_ACCESS =
            new GuardRequirement(Kind.PUBLIC, null, null, null, null, Set.of());

    public GuardRequirement {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        if (kind == Kind.PERMISSION && (resource == null || resource.isBlank() || action == null || action.isBlank())) {
            throw new IllegalArgumentException("permission requirement needs a resource and an action");
        }
        if (kind == Kind.ROLES && (roleMode == null || roleIds.isEmpty())) {
            throw new IllegalArgumentException("roles requirement needs a mode and at least one role");
        }
    }

    /** No check at all. */
    public static GuardRequirement publicAccess() {
        return PUBLIC_ACCESS;
    }

    public static GuardRequirement permission(String resource, String action) {
        return new GuardRequirement(Kind.PERMISSION, resource, action, null, null, Set.of());
    }

    public static GuardRequirement permission(String resource, String action, ConditionGroup conditions) {
        return new GuardRequirement(Kind.PERMISSION, resource, action, conditions, null, Set.of());
    }

    public static GuardRequirement roles(RoleMode mode, String... roleIds) {
        return new GuardRequirement(Kind.ROLES, null, null, null, mode, new LinkedHashSet<>(Arrays.asList(roleIds)));
    }
}
