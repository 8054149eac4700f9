package com.shadi.observability;

/**
 * Health status for an individual dependency.
 */
public enum HealthStatus {

    /** The dependency answers normally. */
    HEALTHY,

    /** The dependency is impaired but the engine can still serve requests from cached state. */
    DEGRADED,

    /** The dependency is down. */
    UNHEALTHY
}
