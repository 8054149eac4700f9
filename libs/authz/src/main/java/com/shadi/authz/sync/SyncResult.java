package com.shadi.authz.sync;

import com.shadi.authz.SubjectSnapshot;

import java.time.Instant;

/**
 * Snapshot handed back by {@link SyncOrchestrator#ensureFresh}, with how much it can be trusted.
 *
 * @param snapshot  permissions to decide with
 * @param status    freshness of {@code snapshot}
 * @param fetchedAt when the snapshot was fetched; null for a revoked (empty) snapshot
 */
public record SyncResult(SubjectSnapshot snapshot, Status status, Instant fetchedAt) {

    public enum Status {
        /** Within TTL. */
        FRESH,
        /** Past TTL, served because the identity provider could not be reached. */
        DEGRADED,
        /** The identity provider rejected the subject; the snapshot is empty. */
        REJECTED
    }

    static SyncResult fresh(CacheEntry entry) {
        return new SyncResult(entry.snapshot(), Status.FRESH, entry.fetchedAt());
    }

    static SyncResult degraded(CacheEntry entry) {
        return new SyncResult(entry.snapshot(), Status.DEGRADED, entry.fetchedAt());
    }

    static SyncResult rejected(String subjectId) {
        return new SyncResult(SubjectSnapshot.empty(subjectId), Status.REJECTED, null);
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
