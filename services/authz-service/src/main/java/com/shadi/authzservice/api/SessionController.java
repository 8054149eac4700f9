package com.shadi.authzservice.api;

import com.shadi.authz.AuthorizationService;
import com.shadi.authz.BearerTokenExtractor;
import com.shadi.authz.claims.TokenInvalidException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session events from the login flow. Login pulls the subject's permissions from the identity
 * provider right away; logout drops them from the cache.
 */
@RestController
@RequestMapping("/api/v1/session")
public class SessionController {

    private final AuthorizationService authorizationService;

    public SessionController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @PostMapping("/login")
    public SyncResponse login(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return SyncResponse.from(authorizationService.onLogin(bearer(authorization)));
    }

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        authorizationService.onLogout(bearer(authorization));
    }

    static String bearer(String authorization) {
        return BearerTokenExtractor.extract(authorization)
                .orElseThrow(() -> new TokenInvalidException("missing bearer token"));
    }
}
