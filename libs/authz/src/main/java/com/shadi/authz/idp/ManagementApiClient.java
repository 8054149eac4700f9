package com.shadi.authz.idp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadi.authz.OrganizationMembership;
import com.shadi.authz.SubjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link IdentityProviderClient} for the provider's management API.
 * <p>
 * Response classification:
 * <ul>
 *   <li>200 with a well-formed body for the requested subject: snapshot</li>
 *   <li>timeout, I/O failure, 5xx, 429, no management token, 401: unavailable</li>
 *   <li>404, any other 4xx, malformed body, body for a different subject: rejected</li>
 * </ul>
 * A 401 means the management token itself was refused; the token is dropped so the next call
 * requests a fresh one.
 */
public class ManagementApiClient implements IdentityProviderClient {

    private static final Logger log = LoggerFactory.getLogger(ManagementApiClient.class);

    private final ManagementApiSettings settings;
    private final ManagementTokenProvider tokenProvider;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ManagementApiClient(ManagementApiSettings settings, ManagementTokenProvider tokenProvider,
                               HttpClient httpClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.tokenProvider = tokenProvider;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * HTTP client with the connect timeout from {@code settings}. Request timeouts are set per request.
     */
    public static HttpClient defaultHttpClient(ManagementApiSettings settings) {
        return HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public SubjectSnapshot fetch(String subjectId) throws ProviderUnavailableException, ProviderRejectedException {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }

        HttpResponse<String> response = send(subjectId);
        int status = response.statusCode();

        if (status == 200) {
            return toSnapshot(subjectId, response.body());
        }
        if (status == 401) {
            tokenProvider.invalidate();
            throw new ProviderUnavailableException(subjectId, "management token refused (HTTP 401)");
        }
        if (status == 429 || status >= 500) {
            throw new ProviderUnavailableException(subjectId, "identity provider returned HTTP " + status);
        }
        if (status == 404) {
            throw new ProviderRejectedException(subjectId, "subject not found");
        }
        throw new ProviderRejectedException(subjectId, "identity provider returned HTTP " + status);
    }

    private HttpResponse<String> send(String subjectId) throws ProviderUnavailableException {
        try {
            String managementToken;
            try {
                managementToken = tokenProvider.currentToken();
            } catch (IOException e) {
                throw new ProviderUnavailableException(subjectId, "no management token: " + e.getMessage(), e);
            }

            HttpRequest request = HttpRequest.newBuilder(settings.authorizationUri(subjectId))
                    .GET()
                    .header("Authorization", "Bearer " + managementToken)
                    .header("Accept", "application/json")
                    .timeout(settings.requestTimeout())
                    .build();
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderUnavailableException(subjectId,
                    "identity provider did not answer within " + settings.requestTimeout(), e);
        } catch (IOException e) {
            throw new ProviderUnavailableException(subjectId, "identity provider I/O failure: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(subjectId, "interrupted while calling identity provider", e);
        }
    }

    private SubjectSnapshot toSnapshot(String subjectId, String body) throws ProviderRejectedException {
        AuthorizationPayload payload;
        try {
            payload = objectMapper.readValue(body, AuthorizationPayload.class);
        } catch (JsonProcessingException e) {
            throw new ProviderRejectedException(subjectId, "malformed authorization body", e);
        }
        if (payload == null) {
            throw new ProviderRejectedException(subjectId, "empty authorization body");
        }
        if (!subjectId.equals(payload.userId())) {
            log.warn("Identity provider answered for '{}' when asked for '{}'", payload.userId(), subjectId);
            throw new ProviderRejectedException(subjectId, "authorization body is for another subject");
        }

        Map<String, OrganizationMembership> memberships = new HashMap<>();
        for (AuthorizationPayload.Organization org : nullToEmpty(payload.organizations())) {
            if (org.id() == null || org.id().isBlank()) {
                throw new ProviderRejectedException(subjectId, "organization entry without id");
            }
            if (memberships.containsKey(org.id())) {
                throw new ProviderRejectedException(subjectId, "duplicate organization " + org.id());
            }
            memberships.put(org.id(), new OrganizationMembership(
                    org.id(), org.role(), Set.copyOf(nullToEmpty(org.permissions()))));
        }

        return new SubjectSnapshot(
                subjectId,
                Set.copyOf(nullToEmpty(payload.roles())),
                Set.copyOf(nullToEmpty(payload.permissions())),
                memberships);
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }
}
