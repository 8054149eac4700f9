package com.shadi.authz.idp;

import com.shadi.authz.SubjectSnapshot;

/**
 * Fetches the authoritative permission snapshot for one subject.
 * <p>
 * Each call is exactly one request to the provider; implementations do not retry. Deduplication
 * and fallback are the sync orchestrator's job.
 */
public interface IdentityProviderClient {

    SubjectSnapshot fetch(String subjectId) throws ProviderUnavailableException, ProviderRejectedException;
}
