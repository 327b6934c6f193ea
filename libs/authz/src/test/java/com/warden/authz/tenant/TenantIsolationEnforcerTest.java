package com.warden.authz.tenant;

import com.warden.authz.model.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.warden.authz.testing.AuthorizationFixtures.OTHER_TENANT;
import static com.warden.authz.testing.AuthorizationFixtures.TENANT;
import static com.warden.authz.testing.AuthorizationFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    private final TenantIsolationEnforcer enforcer = TenantIsolationEnforcer.forTenant(TENANT);
    private final TenantIsolationEnforcer superAdmin =
            new TenantIsolationEnforcer(new TenantContext(TENANT, "ops-1", true));

    private static Role foreignRole(String id) {
        return new Role(id, OTHER_TENANT, id, List.of("unit:read"), List.of(), 0, false);
    }

    @Nested
    @DisplayName("assertions")
    class TenantChecks {

        @Test
        @DisplayName("pass for entities of the context tenant")
        void sameTenant() {
            Role own = role("viewer", "unit:read");

            assertThat(enforcer.assertTenantMatch(own)).isSameAs(own);
            assertThatCode(() -> enforcer.assertTenantId(TENANT)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("throw TenantMismatchException carrying both tenant ids")
        void otherTenant() {
            assertThatThrownBy(() -> enforcer.assertTenantMatch(foreignRole("viewer")))
                    .isInstanceOfSatisfying(TenantMismatchException.class, e -> {
                        assertThat(e.expectedTenantId()).isEqualTo(TENANT);
                        assertThat(e.actualTenantId()).isEqualTo(OTHER_TENANT);
                    })
                    .hasMessageContaining(TENANT)
                    .hasMessageContaining(OTHER_TENANT);
        }

        @Test
        @DisplayName("a missing tenant id is a mismatch")
        void nullTenant() {
            assertThatThrownBy(() -> enforcer.assertTenantId(null))
                    .isInstanceOf(TenantMismatchException.class)
                    .hasMessageContaining("does not belong to tenant");
        }

        @Test
        @DisplayName("a super admin may cross tenants")
        void superAdminCrosses() {
            assertThat(superAdmin.allowsCrossTenant()).isTrue();
            assertThatCode(() -> superAdmin.assertTenantId(OTHER_TENANT)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("filtering")
    class Filtering {

        @Test
        @DisplayName("keeps only the context tenant's entities, in order, skipping nulls")
        void filters() {
            Role first = role("a", "unit:read");
            Role second = role("b", "unit:read");
            List<Role> mixed = new ArrayList<>(Arrays.asList(first, foreignRole("x"), null, second));

            assertThat(enforcer.filter(mixed)).containsExactly(first, second);
            assertThat(superAdmin.filter(mixed)).containsExactly(first, mixed.get(1), second);
            assertThat(enforcer.filter(null)).isEmpty();
        }

        @Test
        @DisplayName("validate hides foreign and missing entities")
        void validates() {
            Role own = role("viewer", "unit:read");

            assertThat(enforcer.validate(own)).contains(own);
            assertThat(enforcer.validate(foreignRole("viewer"))).isEmpty();
            assertThat(enforcer.<Role>validate(null)).isEmpty();
        }

        @Test
        @DisplayName("wrapped lookups never return another tenant's data")
        void wrappedLookups() {
            Map<String, Role> byId = Map.of("own", role("own", "unit:read"), "foreign", foreignRole("foreign"));
            Function<String, Optional<Role>> lookup = enforcer.scoped(byId::get);
            Function<String, List<Role>> all = enforcer.scopedAll(ignored -> byId.values());

            assertThat(lookup.apply("own")).isPresent();
            assertThat(lookup.apply("foreign")).isEmpty();
            assertThat(lookup.apply("missing")).isEmpty();
            assertThat(all.apply("any")).extracting(Role::id).containsExactly("own");
        }

        @Test
        @DisplayName("scopeCriteria adds the tenant to query criteria")
        void scopesCriteria() {
            assertThat(enforcer.scopeCriteria(Map.of("status", "ACTIVE")))
                    .containsEntry("status", "ACTIVE")
                    .containsEntry("tenantId", TENANT);
            assertThat(enforcer.scopeCriteria(Map.of("tenantId", OTHER_TENANT))).containsEntry("tenantId", TENANT);
        }
    }

    @Nested
    @DisplayName("SQL predicates")
    class SqlPredicates {

        @Test
        @DisplayName("whereClause binds the tenant as the first parameter")
        void whereClause() {
            TenantScopedQuery query = enforcer.whereClause();

            assertThat(query.sql()).isEqualTo("tenant_id = $1");
            assertThat(query.params()).containsExactly(TENANT);
        }

        @Test
        @DisplayName("appendTenantFilter numbers the tenant after the existing parameters")
        void appends() {
            TenantScopedQuery query =
                    enforcer.appendTenantFilter("status = $1 AND owner_id = $2", List.of("OPEN", "u-1"));

            assertThat(query.sql()).isEqualTo("status = $1 AND owner_id = $2 AND tenant_id = $3");
            assertThat(query.params()).containsExactly("OPEN", "u-1", TENANT);
        }

        @Test
        @DisplayName("appendTenantFilter on an empty clause yields just the tenant predicate")
        void appendsToEmpty() {
            TenantScopedQuery query = enforcer.appendTenantFilter("", List.of());

            assertThat(query.sql()).isEqualTo("tenant_id = $1");
            assertThat(query.params()).containsExactly(TENANT);
        }
    }

    @Test
    @DisplayName("forCurrentContext fails outside a tenant scope")
    void requiresContext() {
        assertThatThrownBy(TenantIsolationEnforcer::forCurrentContext)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No tenant context");
    }
}
