package com.shadi.authz.testing;

import com.shadi.authz.scope.ProtectedResource;
import com.shadi.authz.scope.ResourceDirectory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ResourceDirectory} over a map, standing in for the vendor table.
 */
public final class InMemoryResourceDirectory implements ResourceDirectory {

    private final Map<String, ProtectedResource> resources = new ConcurrentHashMap<>();

    public InMemoryResourceDirectory add(ProtectedResource resource) {
        resources.put(resource.resourceId(), resource);
        return this;
    }

    /** Adds a vendor record; a null organization makes it a legacy record. */
    public InMemoryResourceDirectory vendor(String vendorId, String organizationId) {
        return add(ProtectedResource.vendor(vendorId, organizationId));
    }

    @Override
    public Optional<ProtectedResource> find(String resourceId) {
        return Optional.ofNullable(resourceId == null ? null : resources.get(resourceId));
    }
}
