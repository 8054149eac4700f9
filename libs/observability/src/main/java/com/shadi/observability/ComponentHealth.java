package com.shadi.observability;

/**
 * Health result for a single dependency.
 *
 * @param name      component name (e.g. "identity-provider", "jwks")
 * @param status    health status of this component
 * @param message   optional human-readable detail
 * @param latencyMs time taken to probe the component, in milliseconds
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
