package com.shadi.authzservice.api;

import com.shadi.authz.AuthorizationDecision;
import com.shadi.authz.AuthorizationService;
import com.shadi.authz.DecisionReason;
import com.shadi.authz.Permission;
import com.shadi.authz.claims.TokenInvalidException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Support tooling: discards a subject's cached permissions and refetches them, e.g. after a grant
 * was changed directly in the identity provider. Requires {@code sync:permissions}.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminSyncController {

    private static final Logger log = LoggerFactory.getLogger(AdminSyncController.class);

    private final AuthorizationService authorizationService;

    public AdminSyncController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @PostMapping("/subjects/{subjectId}/sync")
    public SyncResponse forceSync(
            @PathVariable String subjectId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String action = Permission.SYNC_PERMISSIONS.value();
        AuthorizationDecision decision =
                authorizationService.authorizePlatformAction(
                        SessionController.bearer(authorization), action);
        if (decision.reason() == DecisionReason.TOKEN_INVALID) {
            throw new TokenInvalidException("invalid bearer token");
        }
        if (!decision.allowed()) {
            throw new PermissionDeniedException(action, decision.reason());
        }
        log.info("Admin-triggered permission sync for subject {}", subjectId);
        return SyncResponse.from(authorizationService.forceSync(subjectId));
    }
}
