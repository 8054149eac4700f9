package com.shadi.authz.idp;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Connection settings for the identity provider's management API.
 *
 * @param baseUrl        tenant base URL, e.g. {@code https://shadi.eu.auth0.com}
 * @param clientId       machine-to-machine client id
 * @param clientSecret   machine-to-machine client secret
 * @param audience       management API audience, defaults to {@code {baseUrl}/api/v2/}
 * @param requestTimeout hard timeout for a single request
 * @param connectTimeout TCP connect timeout
 */
public record ManagementApiSettings(
        URI baseUrl,
        String clientId,
        String clientSecret,
        String audience,
        Duration requestTimeout,
        Duration connectTimeout
) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(3);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    public ManagementApiSettings {
        if (baseUrl == null) {
            throw new IllegalArgumentException("baseUrl must not be null");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be null or blank");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("clientSecret must not be null or blank");
        }
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            baseUrl = URI.create(base.substring(0, base.length() - 1));
        }
        if (audience == null || audience.isBlank()) {
            audience = baseUrl + "/api/v2/";
        }
        if (requestTimeout == null) {
            requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        }
        if (connectTimeout == null) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
    }

    public URI tokenUri() {
        return URI.create(baseUrl + "/oauth/token");
    }

    public URI authorizationUri(String subjectId) {
        return URI.create(baseUrl + "/api/v2/users/"
                + URLEncoder.encode(subjectId, StandardCharsets.UTF_8) + "/authorization");
    }

    @Override
    public String toString() {
        return "ManagementApiSettings[baseUrl=%s, clientId=%s, audience=%s, requestTimeout=%s, connectTimeout=%s]"
                .formatted(baseUrl, clientId, audience, requestTimeout, connectTimeout);
    }
}
