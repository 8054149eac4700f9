package com.shadi.authzservice.infrastructure.health;

import com.shadi.observability.ComponentHealth;
import com.shadi.observability.HealthCheckRegistry;
import com.shadi.observability.HealthResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the engine's {@link HealthCheckRegistry} under {@code /actuator/health/authzEngine}.
 *
 * <p>A DEGRADED identity provider keeps the service UP: requests are still answered from cached
 * permissions. Only UNHEALTHY checks take the service DOWN.
 */
@Component("authzEngine")
public class IdentityProviderHealthIndicator implements HealthIndicator {

    private final HealthCheckRegistry registry;

    public IdentityProviderHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        HealthResult result = registry.checkAll();
        Health.Builder builder =
                switch (result.status()) {
                    case HEALTHY -> Health.up();
                    case DEGRADED -> Health.status("DEGRADED");
                    case UNHEALTHY -> Health.down();
                };
        for (ComponentHealth check : result.checks().values()) {
            builder.withDetail(
                    check.name(),
                    check.message() == null
                            ? check.status().name()
                            : check.status().name() + ": " + check.message());
        }
        return builder.withDetail("checkedAt", result.timestamp().toString()).build();
    }
}
