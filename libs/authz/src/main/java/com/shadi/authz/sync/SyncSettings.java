package com.shadi.authz.sync;

import java.time.Duration;

/**
 * @param ttl          how long a fetched snapshot counts as fresh
 * @param maxStaleness how long after the fetch a snapshot may still be served as degraded fallback
 * @param waitTimeout  how long a caller waits on a refresh before falling back
 * @param maxEntries   cache bound, in subjects
 */
public record SyncSettings(Duration ttl, Duration maxStaleness, Duration waitTimeout, long maxEntries) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_MAX_STALENESS = Duration.ofHours(24);
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(5);

    public SyncSettings {
        if (ttl == null) {
            ttl = DEFAULT_TTL;
        }
        if (maxStaleness == null) {
            maxStaleness = DEFAULT_MAX_STALENESS;
        }
        if (waitTimeout == null) {
            waitTimeout = DEFAULT_WAIT_TIMEOUT;
        }
        if (maxEntries <= 0) {
            maxEntries = PermissionCache.DEFAULT_MAXIMUM_SIZE;
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxStaleness.compareTo(ttl) < 0) {
            throw new IllegalArgumentException("maxStaleness must not be shorter than ttl");
        }
        if (waitTimeout.isNegative() || waitTimeout.isZero()) {
            throw new IllegalArgumentException("waitTimeout must be positive");
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(null, null, null, 0);
    }
}
