package com.shadi.authz;

import com.shadi.authz.claims.ClaimsVerifier;
import com.shadi.authz.claims.TokenInvalidException;
import com.shadi.authz.claims.VerifiedIdentity;
import com.shadi.authz.scope.EffectivePermissions;
import com.shadi.authz.scope.EffectiveRoles;
import com.shadi.authz.scope.ProtectedResource;
import com.shadi.authz.scope.ResourceDirectory;
import com.shadi.authz.scope.ScopeResolver;
import com.shadi.authz.sync.StaleAndUnreachableException;
import com.shadi.authz.sync.SyncOrchestrator;
import com.shadi.authz.sync.SyncResult;
import com.shadi.authz.sync.SyncTrigger;
import com.shadi.observability.CorrelationContextHolder;
import com.shadi.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers "may the bearer of this token perform this action on this resource?", and the same
 * question for roles.
 * <p>
 * Every failure along the way (bad token, unknown resource, failed resource lookup, unreachable
 * identity provider) ends in a denial with its reason; no path defaults to allow. A decision made
 * from degraded permissions never grants a high-risk action.
 */
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final ClaimsVerifier claimsVerifier;
    private final ResourceDirectory resourceDirectory;
    private final SyncOrchestrator syncOrchestrator;
    private final ScopeResolver scopeResolver;
    private final AuthorizationSettings settings;
    private final MetricFactory metrics;

    public AuthorizationService(ClaimsVerifier claimsVerifier, ResourceDirectory resourceDirectory,
                                SyncOrchestrator syncOrchestrator, ScopeResolver scopeResolver,
                                AuthorizationSettings settings, MetricFactory metrics) {
        this.claimsVerifier = claimsVerifier;
        this.resourceDirectory = resourceDirectory;
        this.syncOrchestrator = syncOrchestrator;
        this.scopeResolver = scopeResolver;
        this.settings = settings;
        this.metrics = metrics;
    }

    /**
     * Decides on a resource known only by id; its owner is looked up in the resource store.
     */
    public AuthorizationDecision authorize(String token, String resourceId, String action) {
        Optional<VerifiedIdentity> identity = verify(token);
        if (identity.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.TOKEN_INVALID), null, resourceId, action);
        }
        String subjectId = identity.get().subjectId();
        Optional<ProtectedResource> resource;
        try {
            resource = resourceDirectory.find(resourceId);
        } catch (RuntimeException e) {
            log.error("Resource store lookup for {} failed", resourceId, e);
            return record(AuthorizationDecision.deny(DecisionReason.RESOURCE_LOOKUP_FAILED),
                    subjectId, resourceId, action);
        }
        if (resource.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.UNKNOWN_RESOURCE), subjectId, resourceId, action);
        }
        return decide(identity.get(), resource.get(), action);
    }

    /**
     * Decides on a resource whose owner the caller already knows.
     */
    public AuthorizationDecision authorize(String token, ProtectedResource resource, String action) {
        Optional<VerifiedIdentity> identity = verify(token);
        if (identity.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.TOKEN_INVALID),
                    null, resource.resourceId(), action);
        }
        return decide(identity.get(), resource, action);
    }

    /**
     * Decides on an action that is not tied to a resource, against all of the subject's grants.
     */
    public AuthorizationDecision authorizePlatformAction(String token, String action) {
        Optional<VerifiedIdentity> identity = verify(token);
        if (identity.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.TOKEN_INVALID), null, null, action);
        }
        String subjectId = identity.get().subjectId();
        Optional<SyncResult> permissions = currentPermissions(subjectId);
        if (permissions.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.STALE_AND_UNREACHABLE), subjectId, null, action);
        }
        boolean degraded = permissions.get().isDegraded();
        boolean held = action != null && permissions.get().snapshot().globalPermissions().contains(action);
        AuthorizationDecision decision = held
                ? AuthorizationDecision.allow(degraded)
                : AuthorizationDecision.deny(DecisionReason.MISSING_PERMISSION, degraded);
        return record(guardHighRisk(decision, action), subjectId, null, action);
    }

    /**
     * Grants when the subject holds at least one of {@code anyOf} as a platform role. Roles are
     * read from the synced permissions, never from the token.
     */
    public AuthorizationDecision authorizeRole(String token, Set<String> anyOf) {
        String required = describeRoles(anyOf);
        Optional<VerifiedIdentity> identity = verify(token);
        if (identity.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.TOKEN_INVALID), null, null, required);
        }
        String subjectId = identity.get().subjectId();
        Optional<SyncResult> permissions = currentPermissions(subjectId);
        if (permissions.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.STALE_AND_UNREACHABLE),
                    subjectId, null, required);
        }
        SubjectSnapshot snapshot = permissions.get().snapshot();
        EffectiveRoles roles = new EffectiveRoles(snapshot.roles(), EffectivePermissions.Scope.GLOBAL, null);
        return record(roleDecision(roles, anyOf, permissions.get().isDegraded()), subjectId, null, required);
    }

    /**
     * Grants when the subject's role in the organization owning {@code resourceId} is one of
     * {@code anyOf}. Roles held in other organizations never count; a legacy resource is checked
     * against platform roles.
     */
    public AuthorizationDecision authorizeVendorRole(String token, String resourceId, Set<String> anyOf) {
        String required = describeRoles(anyOf);
        Optional<VerifiedIdentity> identity = verify(token);
        if (identity.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.TOKEN_INVALID), null, resourceId, required);
        }
        String subjectId = identity.get().subjectId();
        Optional<ProtectedResource> resource;
        try {
            resource = resourceDirectory.find(resourceId);
        } catch (RuntimeException e) {
            log.error("Resource store lookup for {} failed", resourceId, e);
            return record(AuthorizationDecision.deny(DecisionReason.RESOURCE_LOOKUP_FAILED),
                    subjectId, resourceId, required);
        }
        if (resource.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.UNKNOWN_RESOURCE), subjectId, resourceId, required);
        }
        Optional<SyncResult> permissions = currentPermissions(subjectId);
        if (permissions.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.STALE_AND_UNREACHABLE),
                    subjectId, resourceId, required);
        }
        EffectiveRoles roles = scopeResolver.scopeRoles(permissions.get().snapshot(), resource.get());
        return record(roleDecision(roles, anyOf, permissions.get().isDegraded()), subjectId, resourceId, required);
    }

    /**
     * Verifies the token and refreshes the subject's permissions unconditionally.
     *
     * @throws TokenInvalidException        if the token cannot be trusted
     * @throws StaleAndUnreachableException if the identity provider is down and nothing is cached
     */
    public SyncResult onLogin(String token) {
        VerifiedIdentity identity = claimsVerifier.verify(token);
        bindToContext(identity);
        SyncResult result = syncOrchestrator.ensureFresh(identity.subjectId(), SyncTrigger.LOGIN);
        log.info("Login sync for subject {} finished {}", identity.subjectId(), result.status());
        return result;
    }

    /**
     * Verifies the token and drops the subject's cached permissions.
     *
     * @return the subject logged out
     * @throws TokenInvalidException if the token cannot be trusted
     */
    public String onLogout(String token) {
        VerifiedIdentity identity = claimsVerifier.verify(token);
        bindToContext(identity);
        syncOrchestrator.invalidate(identity.subjectId());
        log.info("Logout for subject {}, cached permissions dropped", identity.subjectId());
        return identity.subjectId();
    }

    /**
     * Discards the cached permissions of {@code subjectId} and fetches them again.
     *
     * @throws StaleAndUnreachableException if the identity provider cannot be reached
     */
    public SyncResult forceSync(String subjectId) {
        return syncOrchestrator.ensureFresh(subjectId, SyncTrigger.FORCE_SYNC);
    }

    private AuthorizationDecision decide(VerifiedIdentity identity, ProtectedResource resource, String action) {
        String subjectId = identity.subjectId();
        if (!Permission.isKnown(action)) {
            log.debug("Action '{}' is not a registered permission, evaluating it as given", action);
        }

        Optional<SyncResult> current = currentPermissions(subjectId);
        if (current.isEmpty()) {
            return record(AuthorizationDecision.deny(DecisionReason.STALE_AND_UNREACHABLE),
                    subjectId, resource.resourceId(), action);
        }
        SyncResult permissions = current.get();

        boolean degraded = permissions.isDegraded();
        EffectivePermissions effective = scopeResolver.scope(permissions.snapshot(), resource);
        AuthorizationDecision decision;
        if (effective.contains(action)) {
            decision = AuthorizationDecision.allow(degraded);
        } else if (effective.noMembership()) {
            decision = AuthorizationDecision.deny(DecisionReason.NO_ORG_MEMBERSHIP, degraded);
        } else {
            decision = AuthorizationDecision.deny(DecisionReason.MISSING_PERMISSION, degraded);
        }
        return record(guardHighRisk(decision, action), subjectId, resource.resourceId(), action);
    }

    private static AuthorizationDecision roleDecision(EffectiveRoles roles, Set<String> anyOf, boolean degraded) {
        if (roles.hasAny(anyOf)) {
            return AuthorizationDecision.allow(degraded);
        }
        if (roles.noMembership()) {
            return AuthorizationDecision.deny(DecisionReason.NO_ORG_MEMBERSHIP, degraded);
        }
        return AuthorizationDecision.deny(DecisionReason.MISSING_ROLE, degraded);
    }

    private static String describeRoles(Set<String> anyOf) {
        if (anyOf == null) {
            return "role:[]";
        }
        return anyOf.stream().filter(Objects::nonNull).sorted().collect(Collectors.joining(",", "role:[", "]"));
    }

    /** Fresh or degraded permissions; empty when nothing is cached and the provider is unreachable. */
    private Optional<SyncResult> currentPermissions(String subjectId) {
        try {
            return Optional.of(syncOrchestrator.ensureFresh(subjectId, SyncTrigger.STALE));
        } catch (StaleAndUnreachableException e) {
            log.warn("No permissions for subject {}: {}", subjectId, e.getMessage());
            return Optional.empty();
        }
    }

    private AuthorizationDecision guardHighRisk(AuthorizationDecision decision, String action) {
        if (decision.allowed() && decision.degraded() && settings.isHighRisk(action)) {
            log.info("Refusing high-risk action '{}' on degraded permissions", action);
            return AuthorizationDecision.deny(DecisionReason.MISSING_PERMISSION, true);
        }
        return decision;
    }

    private Optional<VerifiedIdentity> verify(String token) {
        try {
            VerifiedIdentity identity = claimsVerifier.verify(token);
            bindToContext(identity);
            return Optional.of(identity);
        } catch (TokenInvalidException e) {
            log.info("Denying request with invalid token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static void bindToContext(VerifiedIdentity identity) {
        CorrelationContextHolder.bindSubject(identity.subjectId(), identity.organizationHint());
    }

    private AuthorizationDecision record(AuthorizationDecision decision, String subjectId,
                                         String resourceId, String action) {
        metrics.counter("authz.decisions", "Authorization decisions",
                "reason", decision.reason().name(),
                "degraded", Boolean.toString(decision.degraded())).increment();
        if (decision.allowed()) {
            log.debug("GRANTED {} on {} to {}{}", action, resourceId, subjectId,
                    decision.degraded() ? " (degraded)" : "");
        } else {
            log.info("DENIED {} on {} to {}: {}{}", action, resourceId, subjectId, decision.reason(),
                    decision.degraded() ? " (degraded)" : "");
        }
        return decision;
    }
}
