package org.iceforge.bifrost.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A registered backend, owned by one user, reachable through its access token.
 *
 * <p>Instances are immutable snapshots of the stored row. A connector with a non-null
 * {@code revokedAt} is dead: nothing may be proxied through it again.
 */
public record ProxyConnector(
        String id,
        String ownerId,
        String name,
        String description,
        ConnectorType type,
        String accessToken,
        EncryptedBlob credentials,
        Set<String> allowedOperations,
        boolean visibleToOthers,
        long totalRequests,
        Instant createdAt,
        Instant updatedAt,
        Instant lastAccessedAt,
        Instant revokedAt
) {
    public ProxyConnector {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(credentials, "credentials");
        allowedOperations = allowedOperations == null ? Set.of() : Set.copyOf(allowedOperations);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean allows(String operation) {
        return allowedOperations.contains(ConnectorType.normalizeOperation(operation));
    }

    /** Path under which the direct proxy for this connector is advertised. */
    public String proxyPath() {
        return "/proxy/" + id;
    }

    @Override
    public String toString() {
        return "ProxyConnector[id=" + id + ", owner=" + ownerId + ", type=" + type.wireName()
                + ", ops=" + allowedOperations + ", revoked=" + isRevoked() + "]";
    }
}
