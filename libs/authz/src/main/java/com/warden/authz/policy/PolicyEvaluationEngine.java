package com.warden.authz.policy;

import com.warden.authz.StoreUnavailableException;
import com.warden.authz.condition.AttributeBags;
import com.warden.authz.condition.ConditionEvaluator;
import com.warden.authz.model.AuthorizationRequest;
import com.warden.authz.tenant.TenantIsolationEnforcer;
import com.warden.observability.AuthorizationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Evaluates system and tenant policies against an {@link AuthorizationRequest}.
 *
 * <p>Combining algorithm: deny-overrides over a priority-ordered walk.
 * <ul>
 *   <li>Policies are sorted by priority (highest first), system policies first on ties,
 *       otherwise in store order.</li>
 *   <li>The first matching DENY ends the walk with a denial.</li>
 *   <li>The first matching ALLOW becomes the candidate. The walk continues through every policy
 *       at or above the candidate's priority and then returns the ALLOW.</li>
 *   <li>If nothing matches, access is denied.</li>
 * </ul>
 * Every policy visited is recorded in the evaluation trace, including policies that did not
 * target the request.
 */
public class PolicyEvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluationEngine.class);

    private static final Comparator<Policy> EVALUATION_ORDER =
            Comparator.comparingInt(Policy::priority).reversed()
                    .thenComparing(policy -> !policy.system());

    private final PolicyStore policyStore;
    private final ConditionEvaluator conditionEvaluator;
    private final AuthorizationMetrics metrics;

    public PolicyEvaluationEngine(PolicyStore policyStore) {
        this(policyStore, new ConditionEvaluator(), null);
    }

    /**
     * @param metrics optional; when null, store failures are only logged
     */
    public PolicyEvaluationEngine(PolicyStore policyStore, ConditionEvaluator conditionEvaluator,
                                  AuthorizationMetrics metrics) {
        if (policyStore == null) {
            throw new IllegalArgumentException("policyStore must not be null");
        }
        if (conditionEvaluator == null) {
            throw new IllegalArgumentException("conditionEvaluator must not be null");
        }
        this.policyStore = policyStore;
        this.conditionEvaluator = conditionEvaluator;
        this.metrics = metrics;
    }

    /**
     * Decides the request.
     *
     * @throws StoreUnavailableException if the policy store fails; never converted into a decision
     */
    public AuthorizationDecision evaluate(AuthorizationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        return walk(request, candidatePolicies(request.subject().tenantId()));
    }

    /**
     * Checks the request against the system policies alone, without reading the policy store.
     * Allowed unless one of them denies; used when tenant policies are not consulted.
     */
    public AuthorizationDecision evaluateSystemPolicies(AuthorizationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        AuthorizationDecision decision = walk(request, SystemPolicies.all());
        if (decision.decidingPolicyId() == null) {
            return new AuthorizationDecision(true, "No system policy denied", null, null,
                    decision.evaluationTrace());
        }
        return decision;
    }

    private AuthorizationDecision walk(AuthorizationRequest request, List<Policy> policies) {
        AttributeBags bags = request.attributeBags();
        String action = request.action().name();
        String resourceType = request.resource().type();

        log.debug("Evaluating {} policies: subject={}, action={}, resource={}/{}",
                policies.size(), request.subject().userId(), action, resourceType, request.resource().id());

        List<PolicyEvaluationResult> trace = new ArrayList<>();
        Policy allowPolicy = null;
        int allowRuleIndex = -1;

        for (Policy policy : policies) {
            if (allowPolicy != null && policy.priority() < allowPolicy.priority()) {
                break;
            }
            long start = System.nanoTime();
            boolean applicable = policy.targets().appliesTo(request.subject())
                    && policy.targetsOrganization(request.resource().organizationId());
            if (!applicable) {
                trace.add(result(policy, false, RuleMatch.NONE, start));
                continue;
            }

            RuleMatch match = matchRules(policy, action, resourceType, bags);
            trace.add(result(policy, true, match, start));

            if (match.effect() == PolicyEffect.DENY) {
                log.debug("Denied by policy {} rule {}", policy.id(), match.ruleIndex());
                return new AuthorizationDecision(false,
                        "Denied by policy '%s' rule %d".formatted(policy.name(), match.ruleIndex()),
                        policy.id(), match.ruleIndex(), trace);
            }
            if (match.effect() == PolicyEffect.ALLOW && allowPolicy == null) {
                allowPolicy = policy;
                allowRuleIndex = match.ruleIndex();
            }
        }

        if (allowPolicy != null) {
            log.debug("Allowed by policy {} rule {}", allowPolicy.id(), allowRuleIndex);
            return new AuthorizationDecision(true,
                    "Allowed by policy '%s' rule %d".formatted(allowPolicy.name(), allowRuleIndex),
                    allowPolicy.id(), allowRuleIndex, trace);
        }
        log.debug("No policy matched; denying by default");
        return new AuthorizationDecision(false, "No matching policy; denied by default", null, null, trace);
    }

    /** System policies plus the tenant's active policies, in evaluation order. */
    List<Policy> candidatePolicies(String tenantId) {
        List<Policy> candidates = new ArrayList<>(SystemPolicies.all());
        for (Policy policy : TenantIsolationEnforcer.forTenant(tenantId).filter(fetchPolicies(tenantId))) {
            if (policy.isActive()) {
                candidates.add(policy);
            }
        }
        // List.sort is stable, so equal keys keep store order
        candidates.sort(EVALUATION_ORDER);
        return candidates;
    }

    /**
     * Inside one policy a matching DENY wins over any matching ALLOW. The first matching DENY
     * is reported, otherwise the first matching ALLOW.
     */
    private RuleMatch matchRules(Policy policy, String action, String resourceType, AttributeBags bags) {
        int firstAllow = -1;
        List<PolicyRule> rules = policy.rules();
        for (int i = 0; i < rules.size(); i++) {
            PolicyRule rule = rules.get(i);
            if (rule.effect() == PolicyEffect.ALLOW && firstAllow >= 0) {
                continue;
            }
            if (!rule.covers(action, resourceType)) {
                continue;
            }
            if (rule.conditions() != null && !conditionEvaluator.evaluate(rule.conditions(), bags)) {
                continue;
            }
            if (rule.effect() == PolicyEffect.DENY) {
                return new RuleMatch(PolicyEffect.DENY, i);
            }
            firstAllow = i;
        }
        return firstAllow >= 0 ? new RuleMatch(PolicyEffect.ALLOW, firstAllow) : RuleMatch.NONE;
    }

    private List<Policy> fetchPolicies(String tenantId) {
        try {
            List<Policy> policies = policyStore.getActivePolicies(tenantId);
            return policies == null ? List.of() : policies;
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Policy store failed for tenant {}: {}", tenantId, e.getMessage());
            if (metrics != null) {
                metrics.recordStoreFailure(StoreUnavailableException.Store.POLICY.tag());
            }
            throw new StoreUnavailableException(StoreUnavailableException.Store.POLICY, tenantId, e);
        }
    }

    private static PolicyEvaluationResult result(Policy policy, boolean applicable, RuleMatch match, long startNanos) {
        return new PolicyEvaluationResult(policy.id(), policy.name(), policy.priority(), policy.system(),
                applicable, match.effect() != null, match.effect(),
                match.effect() == null ? null : match.ruleIndex(),
                Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private record RuleMatch(PolicyEffect effect, int ruleIndex) {
        static final RuleMatch NONE = new RuleMatch(null, -1);
    }
}
