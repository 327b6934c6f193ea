package com.warden.authz.guard;

import com.warden.authz.StoreUnavailableException;
import com.warden.authz.condition.ConditionEvaluator;
import com.warden.authz.model.AuthorizationRequest;
import com.warden.authz.model.User;
import com.warden.authz.model.UserRoleAssignment;
import com.warden.authz.service.AuthorizationResult;
import com.warden.authz.service.AuthorizationService;
import com.warden.authz.service.RequestContext;
import com.warden.authz.service.ResourceContext;
import com.warden.authz.tenant.TenantContext;
import com.warden.authz.tenant.TenantContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Checks a {@link GuardRequirement} before an operation runs.
 * <p>
 * Interceptors and filters call {@link #check} with the live principal and translate the
 * outcome into their transport's response. Outcomes carry only generic messages.
 */
public class AuthorizationGuard {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGuard.class);

    private final AuthorizationService authorizationService;
    private final ConditionEvaluator conditionEvaluator;
    private final Clock clock;

    public AuthorizationGuard(AuthorizationService authorizationService, ConditionEvaluator conditionEvaluator,
                              Clock clock) {
        if (authorizationService == null) {
            throw new IllegalArgumentException("authorizationService must not be null");
        }
        if (conditionEvaluator == null) {
            throw new IllegalArgumentException("conditionEvaluator must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.authorizationService = authorizationService;
        this.conditionEvaluator = conditionEvaluator;
        this.clock = clock;
    }

    /**
     * @param requirement what the operation requires
     * @param user        authenticated principal; null for anonymous calls
     * @param resource    the resource, or null to check against the requirement's resource type only
     * @param request     transport context, may be null
     */
    public GuardOutcome check(GuardRequirement requirement, User user, ResourceContext resource,
                              RequestContext request) {
        if (requirement == null) {
            throw new IllegalArgumentException("requirement must not be null");
        }
        if (requirement.kind() == GuardRequirement.Kind.PUBLIC) {
            return GuardOutcome.allowed();
        }
        if (user == null) {
            log.debug("Anonymous call to guarded operation denied");
            return GuardOutcome.denied();
        }
        try {
            return switch (requirement.kind()) {
                case PERMISSION -> checkPermission(requirement, user, resource, request);
                case ROLES -> checkRoles(requirement, user);
                case PUBLIC -> GuardOutcome.allowed();
            };
        } catch (StoreUnavailableException e) {
            log.warn("Guard check for user {} could not be completed: {} store unavailable", user.id(), e.store());
            return GuardOutcome.unavailable();
        }
    }

    /**
     * Runs {@code work} scoped to the user's tenant, typically the data access behind an allowed
     * {@link #check}. {@code INTERNAL_ADMIN} users get a cross-tenant scope.
     *
     * @throws IllegalArgumentException if user is null
     */
    public <T> T callInTenantContext(User user, Supplier<T> work) {
        return TenantContextHolder.callWithTenantContext(TenantContext.forUser(user), work);
    }

    private GuardOutcome checkPermission(GuardRequirement requirement, User user, ResourceContext resource,
                                         RequestContext request) {
        ResourceContext target = resource == null ? ResourceContext.of(requirement.resource(), null) : resource;
        if (!target.type().equals(requirement.resource())) {
            throw new IllegalArgumentException("resource type %s does not match required %s"
                    .formatted(target.type(), requirement.resource()));
        }
        AuthorizationResult result = authorizationService.authorize(user, requirement.action(), target, request);
        if (!result.allowed()) {
            return GuardOutcome.denied();
        }
        if (requirement.conditions() != null) {
            AuthorizationRequest attributes =
                    authorizationService.toAuthorizationRequest(user, requirement.action(), target, request);
            if (!conditionEvaluator.evaluate(requirement.conditions(), attributes.attributeBags())) {
                log.debug("Guard conditions not met for user {} on {}:{}",
                        user.id(), requirement.resource(), requirement.action());
                return GuardOutcome.denied();
            }
        }
        return GuardOutcome.allowed();
    }

    /** Role requirements look at the roles directly assigned through non-expired assignments. */
    private GuardOutcome checkRoles(GuardRequirement requirement, User user) {
        Instant now = clock.instant();
        Set<String> held = new HashSet<>();
        for (UserRoleAssignment assignment : user.roleAssignments()) {
            if (!assignment.isExpiredAt(now)) {
                held.add(assignment.roleId());
            }
        }
        boolean allowed = switch (requirement.roleMode()) {
            case ANY -> requirement.roleIds().stream().anyMatch(held::contains);
            case ALL -> held.containsAll(requirement.roleIds());
        };
        return allowed ? GuardOutcome.allowed() : GuardOutcome.denied();
    }
}
