package com.warden.authz.policy;

import com.warden.authz.model.SubjectAttributes;

import java.util.Set;

/**
 * Principals a policy applies to. A policy with no targets at all applies to everyone;
 * otherwise the subject must match at least one user id, user type or role id.
 *
 * @param userIds   targeted user ids
 * @param roleIds   targeted role ids
 * @param userTypes targeted user types
 */
public record PolicyTargets(Set<String> userIds, Set<String> roleIds, Set<String> userTypes) {

    private static final PolicyTargets EVERYONE = new PolicyTargets(Set.of(), Set.of(), Set.of());

    public PolicyTargets {
        userIds = userIds == null ? Set.of() : Set.copyOf(userIds);
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        userTypes = userTypes == null ? Set.of() : Set.copyOf(userTypes);
    }

    public static PolicyTargets everyone() {
        return EVERYONE;
    }

    public static PolicyTargets roles(String... roleIds) {
        return new PolicyTargets(Set.of(), Set.of(roleIds), Set.of());
    }

    public static PolicyTargets userTypes(String... userTypes) {
        return new PolicyTargets(Set.of(), Set.of(), Set.of(userTypes));
    }

    public boolean isEmpty() {
        return userIds.isEmpty() && roleIds.isEmpty() && userTypes.isEmpty();
    }

    public boolean appliesTo(SubjectAttributes subject) {
        if (isEmpty()) {
            return true;
        }
        if (subject.userId() != null && userIds.contains(subject.userId())) {
            return true;
        }
        if (subject.userType() != null && userTypes.contains(subject.userType())) {
            return true;
        }
        for (String roleId : subject.roleIds()) {
            if (roleIds.contains(roleId)) {
                return true;
            }
        }
        return false;
    }
}
