package com.shadi.authz.scope;

import java.util.Collection;
import java.util.Set;

/**
 * Roles that apply to one resource for one subject: the membership role in the owning
 * organization, or the platform roles for a legacy resource.
 *
 * @param roles          the applicable role names
 * @param scope          how they were chosen
 * @param organizationId organization they were scoped to; null for {@link EffectivePermissions.Scope#GLOBAL}
 */
public record EffectiveRoles(Set<String> roles, EffectivePermissions.Scope scope, String organizationId) {

    public EffectiveRoles {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    /** Role names compare case-insensitively, as vendor roles do. */
    public boolean hasAny(Collection<String> required) {
        if (required == null) {
            return false;
        }
        for (String candidate : required) {
            if (candidate == null) {
                continue;
            }
            for (String held : roles) {
                if (held.equalsIgnoreCase(candidate.strip())) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean noMembership() {
        return scope == EffectivePermissions.Scope.NO_MEMBERSHIP;
    }
}
