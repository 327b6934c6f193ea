package com.warden.authz.spring;

import com.warden.authz.audit.DecisionAuditSink;
import com.warden.authz.audit.LoggingDecisionAuditSink;
import com.warden.authz.codec.PolicyDocumentCodec;
import com.warden.authz.condition.ConditionEvaluator;
import com.warden.authz.condition.OrganizationHierarchy;
import com.warden.authz.guard.AuthorizationGuard;
import com.warden.authz.policy.InMemoryPolicyStore;
import com.warden.authz.policy.PolicyEvaluationEngine;
import com.warden.authz.policy.PolicyStore;
import com.warden.authz.rbac.InMemoryPermissionCache;
import com.warden.authz.rbac.PermissionCache;
import com.warden.authz.rbac.PermissionResolver;
import com.warden.authz.rbac.RoleStore;
import com.warden.authz.service.AuthorizationService;
import com.warden.observability.AuthorizationMetrics;
import com.warden.observability.AuthorizationTracer;
import com.warden.observability.MetadataRedactor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

/**
 * Wires the authorization engine around the application's {@link RoleStore}.
 *
 * <p>The application must provide the role store. Every other bean backs off when the
 * application defines its own:
 *
 * <ul>
 *   <li>{@link PolicyStore}: an {@link InMemoryPolicyStore} loaded from
 *       {@code warden.authz.policy-location}, empty when no location is set
 *   <li>{@link PermissionCache}: an {@link InMemoryPermissionCache}
 *   <li>{@link OrganizationHierarchy}: flat unless the application provides one
 *   <li>metrics go to the application's {@link MeterRegistry}, spans to its {@link OpenTelemetry}
 * </ul>
 *
 * <p>Registered in {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports}.
 */
@AutoConfiguration
@ConditionalOnBean(RoleStore.class)
@EnableConfigurationProperties(WardenAuthzProperties.class)
public class WardenAuthzAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WardenAuthzAutoConfiguration.class);

    /** Instrumentation scope of the spans created by the engine. */
    public static final String INSTRUMENTATION_SCOPE = "com.warden.authz";

    @Bean
    @ConditionalOnMissingBean
    public Clock wardenAuthzClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyStore policyStore(WardenAuthzProperties properties, ResourceLoader resourceLoader) {
        String location = properties.policyLocation();
        if (location == null) {
            log.info("No warden.authz.policy-location set; only system policies apply until a PolicyStore is provided");
            return new InMemoryPolicyStore();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Policy document not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            InMemoryPolicyStore store = InMemoryPolicyStore.fromJson(in);
            log.info("Loaded policy document from {}", location);
            return store;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read policy document " + location, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionCache permissionCache(Clock clock) {
        return new InMemoryPermissionCache(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationMetrics authorizationMetrics(WardenAuthzProperties properties,
                                                     ObjectProvider<MeterRegistry> meterRegistry) {
        return new AuthorizationMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
                properties.serviceName());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationTracer authorizationTracer(ObjectProvider<OpenTelemetry> openTelemetry) {
        return new AuthorizationTracer(openTelemetry.getIfAvailable(OpenTelemetry::noop)
                .getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionResolver permissionResolver(RoleStore roleStore, PermissionCache permissionCache,
                                                 WardenAuthzProperties properties, Clock clock,
                                                 AuthorizationMetrics metrics) {
        return new PermissionResolver(roleStore, permissionCache, properties.resolverConfig(), clock, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator conditionEvaluator(ObjectProvider<OrganizationHierarchy> hierarchy) {
        return new ConditionEvaluator(hierarchy.getIfAvailable(OrganizationHierarchy::flat));
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyEvaluationEngine policyEvaluationEngine(PolicyStore policyStore, ConditionEvaluator evaluator,
                                                         AuthorizationMetrics metrics) {
        return new PolicyEvaluationEngine(policyStore, evaluator, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionAuditSink decisionAuditSink() {
        return new LoggingDecisionAuditSink(PolicyDocumentCodec.objectMapper(), new MetadataRedactor());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationService authorizationService(PermissionResolver resolver, PolicyEvaluationEngine engine,
                                                     WardenAuthzProperties properties, DecisionAuditSink auditSink,
                                                     AuthorizationMetrics metrics, AuthorizationTracer tracer,
                                                     Clock clock) {
        log.info("Authorization engine ready: service={}, abac={}, requireBoth={}, audit={}",
                properties.serviceName(), properties.enableAbac(), properties.requireBoth(),
                properties.auditEnabled());
        return new AuthorizationService(resolver, engine, properties.serviceConfig(), auditSink, metrics, tracer,
                clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationGuard authorizationGuard(AuthorizationService service, ConditionEvaluator evaluator,
                                                 Clock clock) {
        return new AuthorizationGuard(service, evaluator, clock);
    }
}
