package com.warden.authz.condition;

/**
 * A node of a condition tree: either a {@link PolicyCondition} leaf or a {@link ConditionGroup}.
 */
public interface ConditionNode {
}
