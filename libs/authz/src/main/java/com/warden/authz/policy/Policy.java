package com.warden.authz.policy;

import com.warden.authz.model.TenantScoped;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A named, prioritized bundle of rules.
 *
 * @param id                  policy id
 * @param tenantId            owning tenant; {@link SystemPolicies#SYSTEM_TENANT} for built-in policies
 * @param name                display name
 * @param description         free text, may be null
 * @param status              lifecycle state
 * @param priority            higher is evaluated first
 * @param rules               ordered rules
 * @param targets             principals the policy applies to
 * @param targetOrganizations organizations the policy applies to; empty means tenant-wide
 * @param system              built-in policy that tenants cannot edit or remove
 * @param deletedAt           soft-delete marker
 */
public record Policy(
        String id,
        String tenantId,
        String name,
        String description,
        PolicyStatus status,
        int priority,
        List<PolicyRule> rules,
        PolicyTargets targets,
        Set<String> targetOrganizations,
        boolean system,
        Instant deletedAt) implements TenantScoped {

    public Policy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        name = name == null ? id : name;
        status = status == null ? PolicyStatus.ACTIVE : status;
        rules = rules == null ? List.of() : List.copyOf(rules);
        targets = targets == null ? PolicyTargets.everyone() : targets;
        targetOrganizations = targetOrganizations == null ? Set.of() : Set.copyOf(targetOrganizations);
    }

    /** An active tenant policy applying to everyone, tenant-wide. */
    public static Policy of(String id, String tenantId, String name, int priority, List<PolicyRule> rules) {
        return new Policy(id, tenantId, name, null, PolicyStatus.ACTIVE, priority, rules,
                PolicyTargets.everyone(), Set.of(), false, null);
    }

    public boolean isActive() {
        return status == PolicyStatus.ACTIVE && deletedAt == null;
    }

    /** Tenant-wide policies apply to every resource; scoped ones only to resources of a listed organization. */
    public boolean targetsOrganization(String organizationId) {
        if (targetOrganizations.isEmpty()) {
            return true;
        }
        return organizationId != null && targetOrganizations.contains(organizationId);
    }

    public Policy withStatus(PolicyStatus newStatus) {
        return new Policy(id, tenantId, name, description, newStatus, priority, rules, targets,
                targetOrganizations, system, deletedAt);
    }

    public Policy withTargets(PolicyTargets newTargets, Set<String> newTargetOrganizations) {
        return new Policy(id, tenantId, name, description, status, priority, rules, newTargets,
                newTargetOrganizations, system, deletedAt);
    }

    public Policy deletedAt(Instant when) {
        return new Policy(id, tenantId, name, description, status, priority, rules, targets,
                targetOrganizations, system, when);
    }
}
