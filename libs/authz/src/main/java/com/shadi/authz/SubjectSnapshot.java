package com.shadi.authz;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the identity provider says a subject may do, at one point in time.
 * <p>
 * Global permissions are derived rather than stored: platform grants plus the effective
 * permissions of every membership. A snapshot therefore cannot hold an organization grant that
 * is missing from its global view.
 *
 * @param subjectId           identity provider subject id
 * @param roles               platform roles, not tied to any organization
 * @param platformPermissions grants not tied to any organization
 * @param memberships         memberships keyed by organization id
 */
public record SubjectSnapshot(
        String subjectId,
        Set<String> roles,
        Set<String> platformPermissions,
        Map<String, OrganizationMembership> memberships
) {

    public SubjectSnapshot {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        platformPermissions = platformPermissions == null ? Set.of() : Set.copyOf(platformPermissions);
        memberships = memberships == null ? Map.of() : Map.copyOf(memberships);
        memberships.forEach((orgId, membership) -> {
            if (!orgId.equals(membership.organizationId())) {
                throw new IllegalArgumentException(
                        "membership keyed under '%s' belongs to '%s'".formatted(orgId, membership.organizationId()));
            }
        });
    }

    /** A snapshot granting nothing. */
    public static SubjectSnapshot empty(String subjectId) {
        return new SubjectSnapshot(subjectId, Set.of(), Set.of(), Map.of());
    }

    public Set<String> globalPermissions() {
        if (memberships.isEmpty()) {
            return platformPermissions;
        }
        Set<String> all = new HashSet<>(platformPermissions);
        memberships.values().forEach(m -> all.addAll(m.effectivePermissions()));
        return Set.copyOf(all);
    }

    public Optional<OrganizationMembership> membership(String organizationId) {
        return Optional.ofNullable(organizationId == null ? null : memberships.get(organizationId));
    }

    public boolean isEmpty() {
        return roles.isEmpty() && platformPermissions.isEmpty() && memberships.isEmpty();
    }
}
