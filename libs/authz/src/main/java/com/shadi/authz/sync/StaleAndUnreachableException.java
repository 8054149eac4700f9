package com.shadi.authz.sync;

/**
 * No usable permissions for the subject: nothing cached (or the cached entry was evicted) and the
 * identity provider could not be reached in time.
 */
public class StaleAndUnreachableException extends RuntimeException {

    private final String subjectId;

    public StaleAndUnreachableException(String subjectId, String reason, Throwable cause) {
        super("No permissions available for subject '%s': %s".formatted(subjectId, reason), cause);
        this.subjectId = subjectId;
    }

    public String subjectId() {
        return subjectId;
    }
}
