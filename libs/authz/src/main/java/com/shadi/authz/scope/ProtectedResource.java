package com.shadi.authz.scope;

/**
 * Something an action is attempted on.
 *
 * @param resourceType         e.g. {@code vendor}
 * @param resourceId           id in the resource store
 * @param owningOrganizationId owning vendor organization; null for records created before
 *                             organizations existed
 */
public record ProtectedResource(String resourceType, String resourceId, String owningOrganizationId) {

    public ProtectedResource {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be null or blank");
        }
        if (owningOrganizationId != null && owningOrganizationId.isBlank()) {
            owningOrganizationId = null;
        }
    }

    public static ProtectedResource vendor(String vendorId, String organizationId) {
        return new ProtectedResource("vendor", vendorId, organizationId);
    }

    /** True when the resource has no owning organization. */
    public boolean isLegacy() {
        return owningOrganizationId == null;
    }
}
