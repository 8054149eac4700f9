package com.shadi.authz.sync;

import com.shadi.authz.SubjectSnapshot;

import java.time.Duration;
import java.time.Instant;

/**
 * A snapshot as it sits in the {@link PermissionCache}. Replaced wholesale on every refresh.
 *
 * @param subjectId subject the snapshot belongs to
 * @param snapshot  permissions as fetched
 * @param fetchedAt when the identity provider returned them
 * @param ttl       how long they count as fresh
 */
public record CacheEntry(String subjectId, SubjectSnapshot snapshot, Instant fetchedAt, Duration ttl) {

    public CacheEntry {
        if (snapshot == null || fetchedAt == null || ttl == null) {
            throw new IllegalArgumentException("snapshot, fetchedAt and ttl are required");
        }
        if (!snapshot.subjectId().equals(subjectId)) {
            throw new IllegalArgumentException(
                    "snapshot for '%s' cannot be cached under '%s'".formatted(snapshot.subjectId(), subjectId));
        }
    }

    /** True while {@code now - fetchedAt < ttl}. */
    public boolean isFresh(Instant now) {
        return now.isBefore(freshUntil());
    }

    public Instant freshUntil() {
        return fetchedAt.plus(ttl);
    }

    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }
}
