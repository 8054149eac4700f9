package com.shadi.authz.scope;

import com.shadi.authz.OrganizationMembership;
import com.shadi.authz.SubjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Narrows a subject's permissions (and roles) to those that apply to a given resource.
 * <p>
 * A resource owned by an organization is governed only by the subject's membership in that
 * organization; grants held in other organizations never apply. Legacy resources without an
 * owner fall back to the subject's global permissions.
 */
public class ScopeResolver {

    private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

    public EffectivePermissions scope(SubjectSnapshot snapshot, ProtectedResource resource) {
        if (resource.isLegacy()) {
            log.debug("Resource {}/{} has no owning organization, using global permissions of {}",
                    resource.resourceType(), resource.resourceId(), snapshot.subjectId());
            return new EffectivePermissions(snapshot.globalPermissions(), EffectivePermissions.Scope.GLOBAL, null);
        }

        String organizationId = resource.owningOrganizationId();
        Optional<OrganizationMembership> membership = snapshot.membership(organizationId);
        if (membership.isEmpty()) {
            return new EffectivePermissions(Set.of(), EffectivePermissions.Scope.NO_MEMBERSHIP, organizationId);
        }
        return new EffectivePermissions(membership.get().effectivePermissions(),
                EffectivePermissions.Scope.ORGANIZATION, organizationId);
    }

    /**
     * Same narrowing for roles: the role held in the owning organization, or the platform roles
     * for a legacy resource. A membership without a role yields no roles.
     */
    public EffectiveRoles scopeRoles(SubjectSnapshot snapshot, ProtectedResource resource) {
        if (resource.isLegacy()) {
            return new EffectiveRoles(snapshot.roles(), EffectivePermissions.Scope.GLOBAL, null);
        }

        String organizationId = resource.owningOrganizationId();
        Optional<OrganizationMembership> membership = snapshot.membership(organizationId);
        if (membership.isEmpty()) {
            return new EffectiveRoles(Set.of(), EffectivePermissions.Scope.NO_MEMBERSHIP, organizationId);
        }
        String role = membership.get().role();
        return new EffectiveRoles(role == null || role.isBlank() ? Set.of() : Set.of(role),
                EffectivePermissions.Scope.ORGANIZATION, organizationId);
    }
}
