package com.warden.authz.policy;

import com.warden.authz.condition.ConditionGroup;

import java.util.List;

/**
 * One rule of a policy.
 *
 * @param actions    action names the rule covers; {@code *} covers all
 * @param resources  resource types the rule covers; {@code *} covers all
 * @param conditions optional condition tree; null means the rule matches unconditionally
 * @param effect     what a match means
 */
public record PolicyRule(
        List<String> actions,
        List<String> resources,
        ConditionGroup conditions,
        PolicyEffect effect) {

    public static final String ANY = "*";

    public PolicyRule {
        actions = actions == null ? List.of() : List.copyOf(actions);
        resources = resources == null ? List.of() : List.copyOf(resources);
        if (effect == null) {
            throw new IllegalArgumentException("effect must not be null");
        }
    }

    public static PolicyRule allow(List<String> actions, List<String> resources, ConditionGroup conditions) {
        return new PolicyRule(actions, resources, conditions, PolicyEffect.ALLOW);
    }

    public static PolicyRule deny(List<String> actions, List<String> resources, ConditionGroup conditions) {
        return new PolicyRule(actions, resources, conditions, PolicyEffect.DENY);
    }

    /** Whether the action and resource type fall under this rule, ignoring conditions. */
    public boolean covers(String action, String resourceType) {
        return (actions.contains(ANY) || actions.contains(action))
                && (resources.contains(ANY) || resources.contains(resourceType));
    }
}
