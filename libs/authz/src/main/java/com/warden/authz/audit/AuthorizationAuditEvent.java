package com.warden.authz.audit;

import com.warden.authz.policy.PolicyEvaluationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One audited authorization decision, or a failure to reach one.
 *
 * @param timestamp          when the decision was made
 * @param outcome            ALLOW, DENY or ERROR
 * @param tenantId           subject tenant
 * @param userId             subject user
 * @param action             requested action
 * @param resourceType       requested resource type
 * @param resourceId         requested resource id, may be null
 * @param organizationId     resource organization, may be null
 * @param requiredPermission permission checked by RBAC, null for policy-only evaluations
 * @param decidingPolicyId   policy that decided, may be null
 * @param decidingRuleIndex  rule that decided, may be null
 * @param reason             internal reason
 * @param trace              policies evaluated
 * @param requestId          request correlation id
 * @param ipAddress          client address
 * @param metadata           request metadata, redacted before logging
 */
public record AuthorizationAuditEvent(
        Instant timestamp,
        Outcome outcome,
        String tenantId,
        String userId,
        String action,
        String resourceType,
        String resourceId,
        String organizationId,
        String requiredPermission,
        String decidingPolicyId,
        Integer decidingRuleIndex,
        String reason,
        List<PolicyEvaluationResult> trace,
        String requestId,
        String ipAddress,
        Map<String, Object> metadata) {

    public enum Outcome {
        ALLOW,
        DENY,
        ERROR
    }

    public AuthorizationAuditEvent {
        trace = trace == null ? List.of() : List.copyOf(trace);
        metadata = metadata == null ? Map.of() : metadata;
    }

    /** Flat map rendered as the JSON audit line; null fields are left out. */
    Map<String, Object> toStructuredLog(Map<String, Object> redactedMetadata) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("eventType", "AUTHZ_DECISION");
        fields.put("timestamp", timestamp == null ? null : timestamp.toString());
        fields.put("outcome", outcome == null ? null : outcome.name());
        fields.put("tenantId", tenantId);
        fields.put("userId", userId);
        fields.put("action", action);
        fields.put("resourceType", resourceType);
        fields.put("resourceId", resourceId);
        fields.put("organizationId", organizationId);
        fields.put("requiredPermission", requiredPermission);
        fields.put("policyId", decidingPolicyId);
        fields.put("ruleIndex", decidingRuleIndex);
        fields.put("reason", reason);
        fields.put("requestId", requestId);
        fields.put("ipAddress", ipAddress);

        List<Map<String, Object>> policies = new ArrayList<>();
        for (PolicyEvaluationResult result : trace) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("policyId", result.policyId());
            entry.put("applicable", result.applicable());
            entry.put("matched", result.matched());
            if (result.effect() != null) {
                entry.put("effect", result.effect().name());
                entry.put("ruleIndex", result.matchedRuleIndex());
            }
            entry.put("micros", result.evaluationTime().toNanos() / 1_000);
            policies.add(entry);
        }
        fields.put("trace", policies);
        if (!redactedMetadata.isEmpty()) {
            fields.put("metadata", redactedMetadata);
        }
        fields.values().removeIf(value -> value == null);
        return fields;
    }
}
