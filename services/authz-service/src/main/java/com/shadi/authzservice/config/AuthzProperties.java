package com.shadi.authzservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the authorization engine, bound from {@code shadi.authz.*}.
 *
 * <pre>
 * shadi:
 *   authz:
 *     identity-provider:
 *       domain: shadi.eu.auth0.com
 *       audience: https://api.shadi.com
 *       client-id: ...
 *       client-secret: ...
 *     sync:
 *       ttl: 1h
 *       max-staleness: 24h
 *     high-risk-actions: [manage:payments]
 * </pre>
 *
 * <p>Compact constructors fill in defaults before Bean Validation runs.
 *
 * @param identityProvider token issuer and management API. Required.
 * @param sync cache freshness, fallback window and refresh pool
 * @param resourceStore where resource ownership is looked up
 * @param highRiskActions actions never granted from degraded permissions
 */
@ConfigurationProperties(prefix = "shadi.authz")
@Validated
public record AuthzProperties(
        @Valid @NotNull IdentityProvider identityProvider,
        @Valid Sync sync,
        @Valid ResourceStore resourceStore,
        Set<String> highRiskActions) {

    public AuthzProperties {
        if (sync == null) {
            sync = new Sync(null, null, null, 0, 0, false, null, null);
        }
        if (resourceStore == null) {
            resourceStore = new ResourceStore(null, null, null, null);
        }
        if (highRiskActions == null || highRiskActions.isEmpty()) {
            highRiskActions = Set.of("manage:payments");
        }
    }

    /**
     * @param domain tenant domain; the token issuer is {@code https://{domain}/}
     * @param audience API audience tokens must carry
     * @param managementUrl management API base URL, defaults to {@code https://{domain}}
     * @param jwksUri signing key set, defaults to {@code https://{domain}/.well-known/jwks.json}
     * @param clientId machine-to-machine client for the management API
     * @param clientSecret its secret
     * @param requestTimeout hard timeout of one management API call
     * @param connectTimeout TCP connect timeout
     * @param clockSkew tolerated clock difference when checking token expiry
     */
    public record IdentityProvider(
            @NotBlank String domain,
            @NotBlank String audience,
            String managementUrl,
            String jwksUri,
            @NotBlank String clientId,
            @NotBlank String clientSecret,
            Duration requestTimeout,
            Duration connectTimeout,
            Duration clockSkew) {

        public IdentityProvider {
            if (managementUrl == null || managementUrl.isBlank()) {
                managementUrl = "https://" + domain;
            }
            if (jwksUri == null || jwksUri.isBlank()) {
                jwksUri = "https://" + domain + "/.well-known/jwks.json";
            }
            if (requestTimeout == null) {
                requestTimeout = Duration.ofSeconds(3);
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(2);
            }
            if (clockSkew == null) {
                clockSkew = Duration.ofSeconds(30);
            }
        }

        public String issuer() {
            return "https://" + domain + "/";
        }

        @Override
        public String toString() {
            return "IdentityProvider[domain=%s, audience=%s, managementUrl=%s, clientId=%s]"
                    .formatted(domain, audience, managementUrl, clientId);
        }
    }

    /**
     * @param ttl how long fetched permissions count as fresh
     * @param maxStaleness how long stale permissions may still serve as a degraded fallback
     * @param waitTimeout longest a request waits for a refresh
     * @param maxEntries cache bound
     * @param refreshThreads threads calling the identity provider
     * @param sweepEnabled refresh entries shortly before they go stale
     * @param sweepInterval how often the sweep runs
     * @param sweepLead how far ahead of staleness the sweep refreshes
     */
    public record Sync(
            Duration ttl,
            Duration maxStaleness,
            Duration waitTimeout,
            long maxEntries,
            int refreshThreads,
            boolean sweepEnabled,
            Duration sweepInterval,
            Duration sweepLead) {

        public Sync {
            if (ttl == null) {
                ttl = Duration.ofHours(1);
            }
            if (maxStaleness == null) {
                maxStaleness = Duration.ofHours(24);
            }
            if (waitTimeout == null) {
                waitTimeout = Duration.ofSeconds(5);
            }
            if (maxEntries <= 0) {
                maxEntries = 100_000;
            }
            if (refreshThreads <= 0) {
                refreshThreads = 8;
            }
            if (sweepInterval == null) {
                sweepInterval = Duration.ofMinutes(1);
            }
            if (sweepLead == null) {
                sweepLead = Duration.ofMinutes(5);
            }
        }
    }

    /**
     * Read-only ownership lookup. Names are interpolated into SQL, so only plain identifiers are
     * accepted.
     *
     * @param table table holding the resources
     * @param idColumn primary key column
     * @param organizationColumn nullable owning organization column
     * @param resourceType type recorded on resolved resources
     */
    public record ResourceStore(
            @Pattern(regexp = IDENTIFIER) String table,
            @Pattern(regexp = IDENTIFIER) String idColumn,
            @Pattern(regexp = IDENTIFIER) String organizationColumn,
            String resourceType) {

        static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";

        public ResourceStore {
            if (table == null || table.isBlank()) {
                table = "vendors";
            }
            if (idColumn == null || idColumn.isBlank()) {
                idColumn = "id";
            }
            if (organizationColumn == null || organizationColumn.isBlank()) {
                organizationColumn = "organization_id";
            }
            if (resourceType == null || resourceType.isBlank()) {
                resourceType = "vendor";
            }
        }
    }
}
