package com.warden.authz.spring;

import com.warden.authz.audit.DecisionAuditSink;
import com.warden.authz.condition.ConditionEvaluator;
import com.warden.authz.guard.AuthorizationGuard;
import com.warden.authz.policy.InMemoryPolicyStore;
import com.warden.authz.policy.PolicyEvaluationEngine;
import com.warden.authz.policy.PolicyStore;
import com.warden.authz.rbac.InMemoryRoleStore;
import com.warden.authz.rbac.PermissionCache;
import com.warden.authz.rbac.PermissionResolver;
import com.warden.authz.rbac.RoleStore;
import com.warden.authz.service.AuthorizationService;
import com.warden.authz.service.ResourceContext;
import com.warden.observability.AuthorizationMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static com.warden.authz.testing.AuthorizationFixtures.ORG;
import static com.warden.authz.testing.AuthorizationFixtures.USER;
import static com.warden.authz.testing.AuthorizationFixtures.assignment;
import static com.warden.authz.testing.AuthorizationFixtures.role;
import static com.warden.authz.testing.AuthorizationFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WardenAuthzAutoConfiguration")
class WardenAuthzAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WardenAuthzAutoConfiguration.class));

    private static final ResourceContext PROPERTY =
            ResourceContext.of("property", "p-1").inOrganization(ORG).ownedBy(USER);

    @Configuration(proxyBeanMethods = false)
    static class RoleStoreConfig {

        @Bean
        RoleStore roleStore() {
            return new InMemoryRoleStore().save(role("viewer", "property:read"));
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomPolicyStoreConfig {

        @Bean
        PolicyStore customPolicyStore() {
            return tenantId -> List.of();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Test
    @DisplayName("backs off when the application has no role store")
    void backsOffWithoutRoleStore() {
        runner.run(context -> assertThat(context).doesNotHaveBean(AuthorizationService.class));
    }

    @Test
    @DisplayName("wires the whole engine around the role store")
    void wiresEngine() {
        runner.withUserConfiguration(RoleStoreConfig.class).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(PolicyStore.class);
            assertThat(context).hasSingleBean(PermissionCache.class);
            assertThat(context).hasSingleBean(PermissionResolver.class);
            assertThat(context).hasSingleBean(ConditionEvaluator.class);
            assertThat(context).hasSingleBean(PolicyEvaluationEngine.class);
            assertThat(context).hasSingleBean(DecisionAuditSink.class);
            assertThat(context).hasSingleBean(AuthorizationService.class);
            assertThat(context).hasSingleBean(AuthorizationGuard.class);
            assertThat(context.getBean(WardenAuthzProperties.class)).isEqualTo(WardenAuthzProperties.defaults());
        });
    }

    @Nested
    @DisplayName("policies")
    class Policies {

        @Test
        @DisplayName("only system policies apply without a policy location, so every request is denied")
        void noLocation() {
            runner.withUserConfiguration(RoleStoreConfig.class).run(context -> {
                AuthorizationService service = context.getBean(AuthorizationService.class);

                assertThat(service.authorize(user(assignment("viewer")), "read", PROPERTY, null).allowed()).isFalse();
            });
        }

        @Test
        @DisplayName("are loaded from the configured location")
        void fromLocation() {
            runner.withUserConfiguration(RoleStoreConfig.class)
                    .withPropertyValues("warden.authz.policy-location=classpath:authz/policies.json")
                    .run(context -> {
                        AuthorizationService service = context.getBean(AuthorizationService.class);

                        assertThat(service.authorize(user(assignment("viewer")), "read", PROPERTY, null).allowed())
                                .isTrue();
                    });
        }

        @Test
        @DisplayName("a missing policy document fails startup")
        void missingDocument() {
            runner.withUserConfiguration(RoleStoreConfig.class)
                    .withPropertyValues("warden.authz.policy-location=classpath:authz/missing.json")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("an application policy store replaces the in-memory one")
        void customStore() {
            runner.withUserConfiguration(RoleStoreConfig.class, CustomPolicyStoreConfig.class)
                    .withPropertyValues("warden.authz.policy-location=classpath:authz/policies.json")
                    .run(context -> {
                        assertThat(context).hasSingleBean(PolicyStore.class);
                        assertThat(context.getBean(PolicyStore.class)).isNotInstanceOf(InMemoryPolicyStore.class);
                    });
        }
    }

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("are bound from warden.authz.*")
        void bound() {
            runner.withUserConfiguration(RoleStoreConfig.class)
                    .withPropertyValues(
                            "warden.authz.service-name=lease-service",
                            "warden.authz.cache-ttl=5m",
                            "warden.authz.max-inheritance-depth=3",
                            "warden.authz.require-both=false")
                    .run(context -> {
                        WardenAuthzProperties properties = context.getBean(WardenAuthzProperties.class);

                        assertThat(properties.serviceName()).isEqualTo("lease-service");
                        assertThat(properties.cacheTtl()).isEqualTo(Duration.ofMinutes(5));
                        assertThat(properties.maxInheritanceDepth()).isEqualTo(3);
                        assertThat(properties.requireBoth()).isFalse();
                        assertThat(properties.enableAbac()).isTrue();
                        assertThat(context.getBean(AuthorizationMetrics.class).serviceName()).isEqualTo("lease-service");
                    });
        }

        @Test
        @DisplayName("an excessive inheritance depth fails validation")
        void invalidDepth() {
            runner.withUserConfiguration(RoleStoreConfig.class)
                    .withPropertyValues("warden.authz.max-inheritance-depth=100")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("a zero cache TTL fails binding")
        void invalidTtl() {
            runner.withUserConfiguration(RoleStoreConfig.class)
                    .withPropertyValues("warden.authz.cache-ttl=0s")
                    .run(context -> assertThat(context).hasFailed());
        }
    }

    @Test
    @DisplayName("decisions are counted in the application's meter registry")
    void usesApplicationRegistry() {
        runner.withUserConfiguration(RoleStoreConfig.class, MeterRegistryConfig.class).run(context -> {
            context.getBean(AuthorizationService.class).authorize(user(assignment("viewer")), "read", PROPERTY, null);

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.find(AuthorizationMetrics.DECISIONS).counter()).isNotNull();
        });
    }
}
