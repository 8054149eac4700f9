package com.shadi.observability;

/**
 * Lightweight probe of one external dependency.
 * <p>
 * Implementations must return within their own timeout and must not throw; a failed probe is
 * reported as {@link HealthStatus#UNHEALTHY} or {@link HealthStatus#DEGRADED}.
 */
@FunctionalInterface
public interface HealthCheck {

    ComponentHealth check();
}
