package com.shadi.authz.scope;

import java.util.Set;

/**
 * Permissions that apply to one resource for one subject.
 *
 * @param permissions    the applicable grants
 * @param scope          how they were chosen
 * @param organizationId organization they were scoped to; null for {@link Scope#GLOBAL}
 */
public record EffectivePermissions(Set<String> permissions, Scope scope, String organizationId) {

    public enum Scope {
        /** Resource has no owner; every grant the subject holds applies. */
        GLOBAL,
        /** Grants of the subject's membership in the owning organization. */
        ORGANIZATION,
        /** Subject is not a member of the owning organization; nothing applies. */
        NO_MEMBERSHIP
    }

    public EffectivePermissions {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean contains(String action) {
        return action != null && permissions.contains(action);
    }

    public boolean noMembership() {
        return scope == Scope.NO_MEMBERSHIP;
    }
}
