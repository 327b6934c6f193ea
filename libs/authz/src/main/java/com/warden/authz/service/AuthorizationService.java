package com.warden.authz.service;

import com.warden.authz.StoreUnavailableException;
import com.warden.authz.audit.AuthorizationAuditEvent;
import com.warden.authz.audit.DecisionAuditSink;
import com.warden.authz.model.ActionAttributes;
import com.warden.authz.model.AuthorizationRequest;
import com.warden.authz.model.ContextAttributes;
import com.warden.authz.model.ResourceAttributes;
import com.warden.authz.model.SubjectAttributes;
import com.warden.authz.model.User;
import com.warden.authz.model.UserRoleAssignment;
import com.warden.authz.policy.AuthorizationDecision;
import com.warden.authz.policy.PolicyEvaluationEngine;
import com.warden.authz.rbac.PermissionMatcher;
import com.warden.authz.rbac.PermissionResolver;
import com.warden.authz.rbac.ResolvedPermissions;
import com.warden.observability.AuthorizationMetrics;
import com.warden.observability.AuthorizationTracer;
import com.warden.observability.DecisionLogContext;
import com.warden.observability.DecisionLogContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point for authorization checks, combining the RBAC permission check with ABAC policy
 * evaluation.
 * <p>
 * Each decision runs with the caller's tenant, user and request ids in the MDC, inside a tracing
 * span, is counted and timed, and is handed to the audit sink when auditing is enabled.
 * Store failures propagate as {@link StoreUnavailableException} and are never turned into a
 * decision.
 */
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final PermissionResolver permissionResolver;
    private final PolicyEvaluationEngine policyEngine;
    private final AuthorizationServiceConfig config;
    private final DecisionAuditSink auditSink;
    private final AuthorizationMetrics metrics;
    private final AuthorizationTracer tracer;
    private final Clock clock;

    public AuthorizationService(PermissionResolver permissionResolver,
                                PolicyEvaluationEngine policyEngine,
                                AuthorizationServiceConfig config,
                                DecisionAuditSink auditSink,
                                AuthorizationMetrics metrics,
                                AuthorizationTracer tracer,
                                Clock clock) {
        if (permissionResolver == null) {
            throw new IllegalArgumentException("permissionResolver must not be null");
        }
        if (policyEngine == null) {
            throw new IllegalArgumentException("policyEngine must not be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.permissionResolver = permissionResolver;
        this.policyEngine = policyEngine;
        this.config = config;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Decides whether {@code user} may perform {@code action} on {@code resource}.
     *
     * @throws StoreUnavailableException if roles or policies cannot be read
     */
    public AuthorizationResult authorize(User user, String action, ResourceContext resource, RequestContext request) {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource must not be null");
        }
        RequestContext context = request == null ? RequestContext.empty() : request;
        DecisionLogContext logContext =
                new DecisionLogContext(user.tenantId(), user.id(), context.requestId(), context.sessionId());

        return DecisionLogContextHolder.callWithContext(logContext, () -> tracer.inSpan(
                "authz.authorize",
                Map.of("authz.action", action, "authz.resource.type", resource.type()),
                () -> decide(user, action, resource, context),
                AuthorizationResult::allowed));
    }

    /**
     * Evaluates a prepared request against the policies only.
     *
     * @throws StoreUnavailableException if policies cannot be read
     */
    public AuthorizationDecision evaluate(AuthorizationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        SubjectAttributes subject = request.subject();
        DecisionLogContext logContext = new DecisionLogContext(subject.tenantId(), subject.userId(),
                request.context().requestId(), request.context().sessionId());

        return DecisionLogContextHolder.callWithContext(logContext, () -> tracer.inSpan(
                "authz.evaluate",
                Map.of("authz.action", request.action().name(), "authz.resource.type", request.resource().type()),
                () -> {
                    long start = System.nanoTime();
                    AuthorizationDecision decision = evaluatePolicies(request);
                    metrics.recordDecision(subject.tenantId(), decision.allowed(), elapsedSince(start));
                    logOutcome(decision.allowed(), request, decision.reason());
                    audit(() -> decisionEvent(request, null, decision.allowed(), decision, decision.reason()));
                    return decision;
                },
                AuthorizationDecision::allowed));
    }

    private AuthorizationDecision evaluatePolicies(AuthorizationRequest request) {
        try {
            return policyEngine.evaluate(request);
        } catch (StoreUnavailableException e) {
            audit(() -> errorEvent(request, null, e));
            log.warn("Could not evaluate policies for user {}: {} store unavailable",
                    request.subject().userId(), e.store());
            throw e;
        }
    }

    /** RBAC only: does the user hold a permission matching {@code permission}? */
    public boolean hasPermission(User user, String permission) {
        return permissionResolver.hasPermission(user, permission);
    }

    public ResolvedPermissions getPermissions(User user) {
        return permissionResolver.resolvePermissions(user);
    }

    /**
     * Builds the policy request {@code authorize} would evaluate, using the user's current
     * resolved permissions.
     */
    public AuthorizationRequest toAuthorizationRequest(User user, String action, ResourceContext resource,
                                                       RequestContext request) {
        return buildRequest(user, permissionResolver.resolvePermissions(user), action, resource,
                request == null ? RequestContext.empty() : request);
    }

    /** Call after a user's role assignments change. */
    public void invalidateUserPermissions(String userId, String tenantId) {
        permissionResolver.invalidateUser(userId, tenantId);
    }

    private AuthorizationResult decide(User user, String action, ResourceContext resource, RequestContext context) {
        long start = System.nanoTime();
        String requiredPermission = resource.type() + ":" + action;
        AuthorizationRequest request = null;
        try {
            ResolvedPermissions resolved = permissionResolver.resolvePermissions(user);
            request = buildRequest(user, resolved, action, resource, context);
            AuthorizationResult.RbacResult rbac = checkRbac(resolved, requiredPermission, resource);
            AuthorizationResult result = config.enableAbac()
                    ? combine(rbac, policyEngine.evaluate(request))
                    : rbacOnly(rbac, policyEngine.evaluateSystemPolicies(request));

            metrics.recordDecision(user.tenantId(), result.allowed(), elapsedSince(start));
            logOutcome(result.allowed(), request, result.reason());
            AuthorizationRequest audited = request;
            audit(() -> decisionEvent(audited, requiredPermission, result.allowed(),
                    result.abacDecision(), result.reason()));
            return result;
        } catch (StoreUnavailableException e) {
            AuthorizationRequest audited = request != null
                    ? request
                    : buildRequest(user, unresolved(user), action, resource, context);
            audit(() -> errorEvent(audited, requiredPermission, e));
            log.warn("Could not decide {} for user {}: {} store unavailable",
                    requiredPermission, user.id(), e.store());
            throw e;
        }
    }

    /** Same rules as {@link PermissionResolver#hasPermissionInOrg}, applied to already resolved permissions. */
    private static AuthorizationResult.RbacResult checkRbac(ResolvedPermissions resolved, String permission,
                                                            ResourceContext resource) {
        boolean allowed = PermissionMatcher.anyMatches(resolved.permissions(), permission)
                || (resource.organizationId() != null
                && PermissionMatcher.anyMatches(resolved.permissionsIn(resource.organizationId()), permission));
        return new AuthorizationResult.RbacResult(allowed, permission);
    }

    /** Tenant policies are skipped, but a system policy denial still wins over the RBAC grant. */
    private static AuthorizationResult rbacOnly(AuthorizationResult.RbacResult rbac, AuthorizationDecision system) {
        if (system.deniedBySystemPolicy()) {
            return new AuthorizationResult(false, AuthorizationResult.Source.ABAC, rbac, system,
                    "Denied by system policy: " + system.reason());
        }
        String reason = rbac.allowed()
                ? "RBAC: has permission " + rbac.checkedPermission()
                : "RBAC: missing permission " + rbac.checkedPermission();
        return new AuthorizationResult(rbac.allowed(), AuthorizationResult.Source.RBAC, rbac, system, reason);
    }

    private AuthorizationResult combine(AuthorizationResult.RbacResult rbac, AuthorizationDecision abac) {
        if (config.requireBoth()) {
            boolean allowed = rbac.allowed() && abac.allowed();
            String reason;
            if (!rbac.allowed() && !abac.allowed()) {
                reason = "Denied: missing permission %s and %s".formatted(rbac.checkedPermission(), abac.reason());
            } else if (!rbac.allowed()) {
                reason = "Denied by RBAC: missing permission " + rbac.checkedPermission();
            } else if (!abac.allowed()) {
                reason = "Denied by ABAC: " + abac.reason();
            } else {
                reason = "Allowed: has permission and " + abac.reason();
            }
            return new AuthorizationResult(allowed, AuthorizationResult.Source.BOTH, rbac, abac, reason);
        }
        if (abac.deniedBySystemPolicy()) {
            return new AuthorizationResult(false, AuthorizationResult.Source.ABAC, rbac, abac,
                    "Denied by system policy: " + abac.reason());
        }
        boolean allowed = rbac.allowed() || abac.allowed();
        AuthorizationResult.Source source = rbac.allowed() ? AuthorizationResult.Source.RBAC : AuthorizationResult.Source.ABAC;
        String reason = allowed ? "Allowed by " + source : "Denied: neither RBAC nor ABAC allowed";
        return new AuthorizationResult(allowed, source, rbac, abac, reason);
    }

    AuthorizationRequest buildRequest(User user, ResolvedPermissions resolved, String action,
                                      ResourceContext resource, RequestContext context) {
        Instant now = clock.instant();
        Set<String> roleIds = new LinkedHashSet<>();
        Set<String> organizationIds = new LinkedHashSet<>();
        if (user.primaryOrganizationId() != null) {
            organizationIds.add(user.primaryOrganizationId());
        }
        for (UserRoleAssignment assignment : user.roleAssignments()) {
            if (!assignment.isExpiredAt(now)) {
                roleIds.add(assignment.roleId());
                organizationIds.add(assignment.organizationId());
            }
        }
        SubjectAttributes subject = new SubjectAttributes(user.id(), user.tenantId(), user.userType(),
                new ArrayList<>(roleIds), new ArrayList<>(organizationIds), new ArrayList<>(resolved.permissions()),
                user.mfaVerified(), Map.of());
        ResourceAttributes resourceAttributes = new ResourceAttributes(resource.type(), resource.id(),
                resource.tenantId() == null ? user.tenantId() : resource.tenantId(),
                resource.organizationId(), resource.ownerId(), resource.metadata());
        ContextAttributes contextAttributes = new ContextAttributes(context.ipAddress(), context.userAgent(),
                now, context.requestId(), context.sessionId(), context.metadata());
        return new AuthorizationRequest(subject, ActionAttributes.of(action, resource.type()),
                resourceAttributes, contextAttributes);
    }

    private static ResolvedPermissions unresolved(User user) {
        return new ResolvedPermissions(user.id(), user.tenantId(), null, null, false, 0, null);
    }

    private void logOutcome(boolean allowed, AuthorizationRequest request, String reason) {
        if (allowed) {
            log.debug("Access ALLOWED: action={}, resource={}/{}, reason={}", request.action().name(),
                    request.resource().type(), request.resource().id(), reason);
        } else {
            log.info("Access DENIED: action={}, resource={}/{}, reason={}", request.action().name(),
                    request.resource().type(), request.resource().id(), reason);
        }
    }

    private void audit(Supplier<AuthorizationAuditEvent> event) {
        if (!config.auditEnabled()) {
            return;
        }
        try {
            auditSink.record(event.get());
        } catch (RuntimeException e) {
            log.warn("Audit sink failed; decision unaffected: {}", e.toString());
        }
    }

    private AuthorizationAuditEvent decisionEvent(AuthorizationRequest request, String requiredPermission,
                                                  boolean allowed, AuthorizationDecision decision, String reason) {
        return new AuthorizationAuditEvent(
                clock.instant(),
                allowed ? AuthorizationAuditEvent.Outcome.ALLOW : AuthorizationAuditEvent.Outcome.DENY,
                request.subject().tenantId(),
                request.subject().userId(),
                request.action().name(),
                request.resource().type(),
                request.resource().id(),
                request.resource().organizationId(),
                requiredPermission,
                decision == null ? null : decision.decidingPolicyId(),
                decision == null ? null : decision.decidingRuleIndex(),
                reason,
                decision == null ? List.of() : decision.evaluationTrace(),
                request.context().requestId(),
                request.context().ipAddress(),
                auditMetadata(request));
    }

    private AuthorizationAuditEvent errorEvent(AuthorizationRequest request, String requiredPermission,
                                               StoreUnavailableException error) {
        return new AuthorizationAuditEvent(
                clock.instant(),
                AuthorizationAuditEvent.Outcome.ERROR,
                request.subject().tenantId(),
                request.subject().userId(),
                request.action().name(),
                request.resource().type(),
                request.resource().id(),
                request.resource().organizationId(),
                requiredPermission,
                null,
                null,
                error.store() + " store unavailable",
                List.of(),
                request.context().requestId(),
                request.context().ipAddress(),
                auditMetadata(request));
    }

    private static Map<String, Object> auditMetadata(AuthorizationRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (!request.resource().metadata().isEmpty()) {
            metadata.put("resource", request.resource().metadata());
        }
        if (!request.context().metadata().isEmpty()) {
            metadata.put("context", request.context().metadata());
        }
        return metadata;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
