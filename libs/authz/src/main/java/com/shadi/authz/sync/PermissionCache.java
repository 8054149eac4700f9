package com.shadi.authz.sync;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.shadi.authz.SubjectSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Subject id to {@link CacheEntry}, in memory.
 * <p>
 * Reads never block and never trigger a load. Entries past their TTL stay readable, marked stale
 * by {@link CacheEntry#isFresh(Instant)}, until {@code maxStaleness} after they were written;
 * then Caffeine evicts them. Writes are package-private: only the {@link SyncOrchestrator}
 * populates or invalidates entries.
 */
public class PermissionCache {

    public static final long DEFAULT_MAXIMUM_SIZE = 100_000;

    private final Cache<String, CacheEntry> entries;
    private final Clock clock;

    public PermissionCache(Duration maxStaleness, long maximumSize, Clock clock) {
        if (maxStaleness == null || maxStaleness.isNegative() || maxStaleness.isZero()) {
            throw new IllegalArgumentException("maxStaleness must be positive");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(maxStaleness)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    public Optional<CacheEntry> get(String subjectId) {
        return Optional.ofNullable(entries.getIfPresent(subjectId));
    }

    /** Approximate number of cached subjects. */
    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    /**
     * Subjects whose entry is still fresh but becomes stale within {@code lead}.
     */
    public List<String> subjectsNearingExpiry(Instant now, Duration lead) {
        Instant horizon = now.plus(lead);
        return entries.asMap().values().stream()
                .filter(entry -> entry.isFresh(now) && !entry.freshUntil().isAfter(horizon))
                .map(CacheEntry::subjectId)
                .toList();
    }

    CacheEntry put(String subjectId, SubjectSnapshot snapshot, Duration ttl) {
        CacheEntry entry = new CacheEntry(subjectId, snapshot, clock.instant(), ttl);
        entries.put(subjectId, entry);
        return entry;
    }

    void invalidate(String subjectId) {
        entries.invalidate(subjectId);
    }
}
