package com.warden.authz.condition;

import java.util.List;

/**
 * Logical combination of condition nodes. Groups nest arbitrarily.
 *
 * @param logic      how children are combined; null only for malformed documents
 * @param conditions children, evaluated in order
 */
public record ConditionGroup(Logic logic, List<ConditionNode> conditions) implements ConditionNode {

    public enum Logic {
        AND,
        OR
    }

    public ConditionGroup {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static ConditionGroup and(ConditionNode... conditions) {
        return new ConditionGroup(Logic.AND, List.of(conditions));
    }

    public static ConditionGroup or(ConditionNode... conditions) {
        return new ConditionGroup(Logic.OR, List.of(conditions));
    }
}
