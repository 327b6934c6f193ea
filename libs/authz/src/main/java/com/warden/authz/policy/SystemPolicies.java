package com.warden.authz.policy;

import com.warden.authz.condition.AttributeSource;
import com.warden.authz.condition.ConditionGroup;
import com.warden.authz.condition.ConditionOperator;
import com.warden.authz.condition.PolicyCondition;
import com.warden.authz.model.User;

import java.util.List;
import java.util.Set;

/**
 * Built-in deny policies merged into every evaluation ahead of tenant policies.
 * <p>
 * All three sit at {@link Integer#MAX_VALUE}, so no tenant ALLOW can be accepted before they
 * have been checked.
 */
public final class SystemPolicies {

    public static final String SYSTEM_TENANT = "*";
    public static final int SYSTEM_PRIORITY = Integer.MAX_VALUE;

    public static final String TENANT_ISOLATION_ID = "system:tenant-isolation";
    public static final String ORGANIZATION_HIERARCHY_ID = "system:organization-hierarchy";
    public static final String CUSTOMER_OWN_RESOURCES_ID = "system:customer-own-resources";

    /** Resource types a customer may only touch when they own them. */
    public static final List<String> CUSTOMER_OWNED_RESOURCE_TYPES =
            List.of("lease", "payment", "maintenance", "document");
    public static final List<String> CUSTOMER_OWNED_ACTIONS = List.of("read", "update", "list");

    private static final List<Policy> ALL = List.of(
            tenantIsolation(),
            organizationHierarchy(),
            customerOwnResources());

    private SystemPolicies() {
        // utility class
    }

    public static List<Policy> all() {
        return ALL;
    }

    public static boolean isSystemPolicyId(String policyId) {
        return ALL.stream().anyMatch(p -> p.id().equals(policyId));
    }

    private static Policy tenantIsolation() {
        ConditionGroup crossTenant = ConditionGroup.and(
                PolicyCondition.ref(AttributeSource.SUBJECT, "tenantId", ConditionOperator.NOT_EQUALS,
                        "resource.tenantId"));
        return system(TENANT_ISOLATION_ID, "Tenant Isolation",
                "Denies any access to resources of another tenant",
                PolicyRule.deny(List.of(PolicyRule.ANY), List.of(PolicyRule.ANY), crossTenant));
    }

    private static Policy organizationHierarchy() {
        ConditionGroup foreignOrganization = ConditionGroup.and(
                PolicyCondition.of(AttributeSource.RESOURCE, "organizationId", ConditionOperator.EXISTS, true),
                PolicyCondition.ref(AttributeSource.RESOURCE, "organizationId", ConditionOperator.NOT_IN,
                        "subject.organizationIds"));
        return system(ORGANIZATION_HIERARCHY_ID, "Organization Hierarchy",
                "Denies access to resources of organizations the subject does not belong to",
                PolicyRule.deny(List.of(PolicyRule.ANY), List.of(PolicyRule.ANY), foreignOrganization));
    }

    private static Policy customerOwnResources() {
        // A resource without an owner counts as not owned by the customer.
        ConditionGroup notOwnedByCustomer = ConditionGroup.and(
                PolicyCondition.of(AttributeSource.SUBJECT, "userType", ConditionOperator.EQUALS, User.TYPE_CUSTOMER),
                ConditionGroup.or(
                        PolicyCondition.of(AttributeSource.RESOURCE, "ownerId", ConditionOperator.EXISTS, false),
                        PolicyCondition.ref(AttributeSource.SUBJECT, "userId", ConditionOperator.NOT_EQUALS,
                                "resource.ownerId")));
        return system(CUSTOMER_OWN_RESOURCES_ID, "Customer Own Resources",
                "Customers may only read, update or list their own leases, payments, maintenance requests and documents",
                PolicyRule.deny(CUSTOMER_OWNED_ACTIONS, CUSTOMER_OWNED_RESOURCE_TYPES, notOwnedByCustomer));
    }

    private static Policy system(String id, String name, String description, PolicyRule rule) {
        return new Policy(id, SYSTEM_TENANT, name, description, PolicyStatus.ACTIVE, SYSTEM_PRIORITY,
                List.of(rule), PolicyTargets.everyone(), Set.of(), true, null);
    }
}
