package com.shadi.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named collection of {@link HealthCheck}s aggregated into one {@link HealthResult}.
 * <p>
 * Checks run sequentially on the caller's thread; each is expected to bound its own probe.
 * A check that throws anyway is reported as UNHEALTHY rather than failing the whole report.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final Clock clock;

    public HealthCheckRegistry() {
        this(Clock.systemUTC());
    }

    public HealthCheckRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /**
     * Registers {@code check} under {@code name}, replacing any existing check of that name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    public HealthResult checkAll() {
        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;

        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().check();
            } catch (RuntimeException e) {
                log.warn("Health check '{}' threw instead of reporting", name, e);
                result = ComponentHealth.unhealthy(name, "check failed: " + e.getMessage(), 0);
            }
            results.put(name, result);
            overall = worse(overall, result.status());
        }

        return new HealthResult(overall, results, clock.instant());
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus worse(HealthStatus a, HealthStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
