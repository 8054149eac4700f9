package com.shadi.authz;

/**
 * Why a decision came out the way it did. Only {@link #GRANTED} allows.
 */
public enum DecisionReason {

    GRANTED,

    /** Permissions were resolved but did not include the action. */
    MISSING_PERMISSION,

    /** Roles were resolved but none of the required ones was among them. */
    MISSING_ROLE,

    /** The resource belongs to an organization the subject is not a member of. */
    NO_ORG_MEMBERSHIP,

    /** No usable permission data: nothing cached and the identity provider could not be reached. */
    STALE_AND_UNREACHABLE,

    /** The bearer token failed verification. */
    TOKEN_INVALID,

    /** The resource store has no record of the resource. */
    UNKNOWN_RESOURCE,

    /** The resource store could not be queried. */
    RESOURCE_LOOKUP_FAILED
}
