package com.shadi.authz.idp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code GET /api/v2/users/{id}/authorization}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record AuthorizationPayload(
        @JsonProperty("user_id") String userId,
        @JsonProperty("roles") List<String> roles,
        @JsonProperty("permissions") List<String> permissions,
        @JsonProperty("organizations") List<Organization> organizations
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Organization(
            @JsonProperty("id") String id,
            @JsonProperty("role") String role,
            @JsonProperty("permissions") List<String> permissions
    ) {
    }
}
