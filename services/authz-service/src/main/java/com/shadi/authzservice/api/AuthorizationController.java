package com.shadi.authzservice.api;

import com.shadi.authz.AuthorizationDecision;
import com.shadi.authz.AuthorizationService;
import com.shadi.authz.BearerTokenExtractor;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Decision endpoint for the platform's business services.
 *
 * <p>Answers 200 for every well-formed request: a denial, including one for a missing or invalid
 * token or a resource store that cannot be reached, is a result and not an error. The caller
 * enforces it.
 */
@RestController
@RequestMapping("/api/v1")
public class AuthorizationController {

    private final AuthorizationService authorizationService;

    public AuthorizationController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @PostMapping("/authorize")
    public AuthorizeResponse authorize(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody AuthorizeRequest request) {
        String token = BearerTokenExtractor.extract(authorization).orElse(null);
        AuthorizationDecision decision =
                authorizationService.authorize(token, request.resourceId(), request.action());
        return AuthorizeResponse.from(decision);
    }

    /** Role check: the role held in the resource's organization, or a platform role. */
    @PostMapping("/authorize/role")
    public AuthorizeResponse authorizeRole(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody AuthorizeRoleRequest request) {
        String token = BearerTokenExtractor.extract(authorization).orElse(null);
        AuthorizationDecision decision = request.platformWide()
                ? authorizationService.authorizeRole(token, request.anyOf())
                : authorizationService.authorizeVendorRole(token, request.resourceId(), request.anyOf());
        return AuthorizeResponse.from(decision);
    }
}
