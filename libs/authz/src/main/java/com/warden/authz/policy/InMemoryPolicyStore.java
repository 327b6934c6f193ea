package com.warden.authz.policy;

import com.warden.authz.codec.PolicyDocumentCodec;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PolicyStore} kept in memory, in insertion order. Saving a policy with an existing id
 * replaces it in place.
 */
public class InMemoryPolicyStore implements PolicyStore {

    private final Map<String, Policy> policies = new LinkedHashMap<>();

    /** Loads a JSON policy document (see {@link PolicyDocumentCodec}). */
    public static InMemoryPolicyStore fromJson(InputStream json) {
        InMemoryPolicyStore store = new InMemoryPolicyStore();
        PolicyDocumentCodec.readPolicies(json).forEach(store::save);
        return store;
    }

    public static InMemoryPolicyStore fromJson(String json) {
        InMemoryPolicyStore store = new InMemoryPolicyStore();
        PolicyDocumentCodec.readPolicies(json).forEach(store::save);
        return store;
    }

    /**
     * @throws IllegalArgumentException for system policies, which are built in and not stored
     */
    public synchronized InMemoryPolicyStore save(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (policy.system() || SystemPolicies.isSystemPolicyId(policy.id())) {
            throw new IllegalArgumentException("system policies cannot be stored: " + policy.id());
        }
        policies.put(key(policy.tenantId(), policy.id()), policy);
        return this;
    }

    public synchronized void remove(String tenantId, String policyId) {
        policies.remove(key(tenantId, policyId));
    }

    /** All stored policies of the tenant, inactive ones included. */
    public synchronized List<Policy> getAllPolicies(String tenantId) {
        List<Policy> result = new ArrayList<>();
        for (Policy policy : policies.values()) {
            if (policy.tenantId().equals(tenantId)) {
                result.add(policy);
            }
        }
        return result;
    }

    @Override
    public synchronized List<Policy> getActivePolicies(String tenantId) {
        List<Policy> result = new ArrayList<>();
        for (Policy policy : policies.values()) {
            if (policy.tenantId().equals(tenantId) && policy.isActive()) {
                result.add(policy);
            }
        }
        return result;
    }

    private static String key(String tenantId, String policyId) {
        return tenantId + ":" + policyId;
    }
}
