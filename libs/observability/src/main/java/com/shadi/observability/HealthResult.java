package com.shadi.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate of every registered {@link HealthCheck}.
 *
 * @param status    worst status among the components (HEALTHY when nothing is registered)
 * @param checks    per-component results keyed by component name
 * @param timestamp when the checks ran
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
