package com.shadi.authzservice.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.Set;

/**
 * @param resourceId resource whose owning organization scopes the check; omit for platform roles
 * @param anyOf roles of which the subject must hold at least one, e.g. {@code owner}
 */
public record AuthorizeRoleRequest(String resourceId, @NotEmpty Set<@NotBlank String> anyOf) {

    public boolean platformWide() {
        return resourceId == null || resourceId.isBlank();
    }
}
