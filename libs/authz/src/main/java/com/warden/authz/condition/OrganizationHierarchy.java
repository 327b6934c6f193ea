package com.warden.authz.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Looks up the ancestors of an organization, used by the {@code in_org_hierarchy} operator.
 */
@FunctionalInterface
public interface OrganizationHierarchy {

    /**
     * Returns the ancestor ids of {@code organizationId}, nearest first. Unknown ids have no ancestors.
     */
    List<String> ancestorsOf(String organizationId);

    /** A hierarchy where no organization has ancestors. */
    static OrganizationHierarchy flat() {
        return organizationId -> List.of();
    }

    /**
     * A hierarchy backed by a child → parent map. Walks parents until a root or a repeat is reached.
     */
    static OrganizationHierarchy fromParents(Map<String, String> parentByChild) {
        Map<String, String> parents = Map.copyOf(parentByChild);
        return organizationId -> {
            List<String> ancestors = new ArrayList<>();
            String current = parents.get(organizationId);
            while (current != null && !ancestors.contains(current) && !current.equals(organizationId)) {
                ancestors.add(current);
                current = parents.get(current);
            }
            return List.copyOf(ancestors);
        };
    }
}
