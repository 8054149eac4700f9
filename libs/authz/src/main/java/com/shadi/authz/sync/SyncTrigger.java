package com.shadi.authz.sync;

/**
 * Why a permission sync was requested.
 */
public enum SyncTrigger {

    /** Subject just authenticated: always refresh. */
    LOGIN,

    /** Ordinary request: refresh only when the cached entry is missing or past its TTL. */
    STALE,

    /** Administrative resync: drop the cached entry, then refresh. */
    FORCE_SYNC
}
