package com.shadi.authz.scope;

import java.util.Optional;

/**
 * Read-only lookup of a resource's owning organization in the business database.
 */
@FunctionalInterface
public interface ResourceDirectory {

    Optional<ProtectedResource> find(String resourceId);
}
