package com.warden.authz.policy;

import java.util.List;

/**
 * Outcome of {@link PolicyEvaluationEngine#evaluate}.
 * <p>
 * {@code reason} names policies and is meant for audit logs only. Show end users
 * {@link #publicMessage()} instead.
 *
 * @param allowed           final outcome
 * @param reason            internal explanation
 * @param decidingPolicyId  policy that decided, null when no policy matched
 * @param decidingRuleIndex rule index inside that policy, null when no policy matched
 * @param evaluationTrace   every policy considered, in evaluation order
 */
public record AuthorizationDecision(
        boolean allowed,
        String reason,
        String decidingPolicyId,
        Integer decidingRuleIndex,
        List<PolicyEvaluationResult> evaluationTrace) {

    public static final String NOT_AUTHORIZED = "Not authorized";

    public AuthorizationDecision {
        evaluationTrace = evaluationTrace == null ? List.of() : List.copyOf(evaluationTrace);
    }

    /** True when one of the {@link SystemPolicies} denied the request. */
    public boolean deniedBySystemPolicy() {
        return !allowed && SystemPolicies.isSystemPolicyId(decidingPolicyId);
    }

    public String publicMessage() {
        return allowed ? "Authorized" : NOT_AUTHORIZED;
    }
}
