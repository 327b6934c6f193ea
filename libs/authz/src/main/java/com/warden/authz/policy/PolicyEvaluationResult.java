package com.warden.authz.policy;

import java.time.Duration;

/**
 * One entry of the evaluation trace.
 *
 * @param policyId         evaluated policy
 * @param policyName       its name
 * @param priority         its priority
 * @param system           whether it is a built-in policy
 * @param applicable       whether it targeted the principal and organization
 * @param matched          whether any rule matched
 * @param effect           effect of the reported rule, null when nothing matched
 * @param matchedRuleIndex index of the reported rule, null when nothing matched
 * @param evaluationTime   time spent on this policy
 */
public record PolicyEvaluationResult(
        String policyId,
        String policyName,
        int priority,
        boolean system,
        boolean applicable,
        boolean matched,
        PolicyEffect effect,
        Integer matchedRuleIndex,
        Duration evaluationTime) {
}
