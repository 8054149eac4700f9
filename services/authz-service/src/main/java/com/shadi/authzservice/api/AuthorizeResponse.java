package com.shadi.authzservice.api;

import com.shadi.authz.AuthorizationDecision;

public record AuthorizeResponse(boolean allowed, String reason, boolean degraded) {

    public static AuthorizeResponse from(AuthorizationDecision decision) {
        return new AuthorizeResponse(
                decision.allowed(), decision.reason().name(), decision.degraded());
    }
}
