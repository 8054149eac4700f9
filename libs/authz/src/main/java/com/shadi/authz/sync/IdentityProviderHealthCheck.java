package com.shadi.authz.sync;

import com.shadi.observability.ComponentHealth;
import com.shadi.observability.HealthCheck;

import java.time.Instant;

/**
 * Reports the identity provider as DEGRADED when the most recent refresh could not reach it.
 * Passive: reads what refreshes observed and never calls the provider itself.
 */
public class IdentityProviderHealthCheck implements HealthCheck {

    public static final String NAME = "identity-provider";

    private final SyncOrchestrator orchestrator;

    public IdentityProviderHealthCheck(SyncOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public ComponentHealth check() {
        Instant failure = orchestrator.lastProviderFailure();
        Instant success = orchestrator.lastProviderSuccess();
        if (failure != null && (success == null || failure.isAfter(success))) {
            return ComponentHealth.degraded(NAME,
                    "last refresh at " + failure + " could not reach the identity provider", 0);
        }
        return ComponentHealth.healthy(NAME, 0);
    }
}
