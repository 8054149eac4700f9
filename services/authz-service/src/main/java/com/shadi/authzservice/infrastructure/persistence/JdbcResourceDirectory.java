package com.shadi.authzservice.infrastructure.persistence;

import com.shadi.authz.scope.ProtectedResource;
import com.shadi.authz.scope.ResourceDirectory;
import com.shadi.authzservice.config.AuthzProperties;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Looks up which organization owns a resource in the platform database. Read-only; a null owner
 * column marks a legacy record.
 */
public class JdbcResourceDirectory implements ResourceDirectory {

    private static final Logger log = LoggerFactory.getLogger(JdbcResourceDirectory.class);

    private final JdbcTemplate jdbcTemplate;
    private final String resourceType;
    private final String query;

    public JdbcResourceDirectory(JdbcTemplate jdbcTemplate, AuthzProperties.ResourceStore store) {
        this.jdbcTemplate = jdbcTemplate;
        this.resourceType = store.resourceType();
        this.query =
                "SELECT %s FROM %s WHERE %s = ?"
                        .formatted(store.organizationColumn(), store.table(), store.idColumn());
    }

    @Override
    public Optional<ProtectedResource> find(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            return Optional.empty();
        }
        List<String> owners = jdbcTemplate.queryForList(query, String.class, resourceId);
        if (owners.isEmpty()) {
            log.debug("No {} with id {}", resourceType, resourceId);
            return Optional.empty();
        }
        return Optional.of(new ProtectedResource(resourceType, resourceId, owners.get(0)));
    }
}
