package com.shadi.authzservice.api;

import com.shadi.authz.sync.SyncResult;
import java.time.Instant;

/**
 * Outcome of a permission sync.
 *
 * @param subjectId whose permissions were synced
 * @param status FRESH, DEGRADED (served from stale cache) or REJECTED (revoked)
 * @param fetchedAt when the served permissions were fetched; null when revoked
 */
public record SyncResponse(String subjectId, String status, Instant fetchedAt) {

    public static SyncResponse from(SyncResult result) {
        return new SyncResponse(
                result.snapshot().subjectId(), result.status().name(), result.fetchedAt());
    }
}
