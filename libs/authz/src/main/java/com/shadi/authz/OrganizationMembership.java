package com.shadi.authz;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A subject's membership in one vendor organization.
 *
 * @param organizationId the organization
 * @param role           role name as reported by the identity provider, may be null
 * @param permissions    permissions granted explicitly for this organization
 */
public record OrganizationMembership(String organizationId, String role, Set<String> permissions) {

    public OrganizationMembership {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public Optional<VendorRole> vendorRole() {
        return VendorRole.fromString(role);
    }

    /**
     * Explicit grants plus the bundle implied by the role, when the role is a known vendor role.
     */
    public Set<String> effectivePermissions() {
        Optional<VendorRole> vendorRole = vendorRole();
        if (vendorRole.isEmpty()) {
            return permissions;
        }
        Set<String> effective = new HashSet<>(permissions);
        effective.addAll(vendorRole.get().impliedPermissionValues());
        return Set.copyOf(effective);
    }
}
