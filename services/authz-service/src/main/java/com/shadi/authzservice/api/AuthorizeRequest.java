package com.shadi.authzservice.api;

import jakarta.validation.constraints.NotBlank;

/**
 * @param resourceId id of the resource in the platform database
 * @param action permission string, e.g. {@code edit:vendor_info}
 */
public record AuthorizeRequest(@NotBlank String resourceId, @NotBlank String action) {}
