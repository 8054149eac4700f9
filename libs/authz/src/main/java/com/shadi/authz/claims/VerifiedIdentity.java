package com.shadi.authz.claims;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Identity extracted from a token whose signature and claims checked out.
 * <p>
 * Role, permission and organization values are hints copied from the token. They can be up to a
 * token lifetime old and are never used to grant access; authoritative permissions come from the
 * identity provider through the sync orchestrator.
 *
 * @param subjectId          {@code sub} claim
 * @param roleHints          roles claimed by the token
 * @param permissionHints    permissions claimed by the token
 * @param organizationHint   {@code org_id} claim, may be null
 * @param expiresAt          token expiry
 */
public record VerifiedIdentity(
        String subjectId,
        Set<String> roleHints,
        Set<String> permissionHints,
        String organizationHint,
        Instant expiresAt
) {

    public VerifiedIdentity {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }
        roleHints = roleHints == null ? Set.of() : Set.copyOf(roleHints);
        permissionHints = permissionHints == null ? Set.of() : Set.copyOf(permissionHints);
    }

    public Optional<String> organization() {
        return Optional.ofNullable(organizationHint);
    }
}
