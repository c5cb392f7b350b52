package org.iceforge.bifrost.gateway.api;

import org.iceforge.bifrost.model.LinkStatus;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.usage.UsageStats;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Request and response bodies of the admin API. Serialized in snake_case. */
public final class AdminModels {
    private AdminModels() {}

    public record ConnectorRequest(
            String name,
            String description,
            String type,
            Map<String, String> connectionConfig,
            Set<String> allowedOperations,
            Boolean visibleToOthers
    ) {}

    public record ConnectorUpdateRequest(
            String name,
            String description,
            Map<String, String> connectionConfig,
            Set<String> allowedOperations,
            Boolean visibleToOthers
    ) {}

    /** Never carries the connection config; secrets do not leave the vault through this API. */
    public record ConnectorView(
            String id,
            String name,
            String description,
            String type,
            String accessToken,
            String proxyUrl,
            List<String> allowedOperations,
            boolean visibleToOthers,
            long totalRequests,
            Instant createdAt,
            Instant updatedAt,
            Instant lastAccessedAt
    ) {
        static ConnectorView of(ProxyConnector c, String proxyUrl) {
            return new ConnectorView(c.id(), c.name(), c.description(), c.type().wireName(), c.accessToken(), proxyUrl,
                    c.allowedOperations().stream().sorted().toList(), c.visibleToOthers(), c.totalRequests(),
                    c.createdAt(), c.updatedAt(), c.lastAccessedAt());
        }
    }

    /**
     * Exactly one of {@code connectorId} and {@code datasetId}. {@code expiresInHours} is used
     * when {@code expiresAt} is absent.
     */
    public record LinkRequest(
            String connectorId,
            String datasetId,
            String name,
            String description,
            String sharingLevel,
            Boolean requiresAuthentication,
            String password,
            Instant expiresAt,
            Integer expiresInHours,
            Integer maxUses,
            List<String> allowedUsers
    ) {}

    public record LinkView(
            String shareId,
            String targetType,
            String targetId,
            String name,
            String description,
            String publicUrl,
            LinkStatus status,
            boolean requiresAuthentication,
            boolean passwordProtected,
            Instant expiresAt,
            Integer maxUses,
            long currentUses,
            List<String> allowedUsers,
            String createdBy,
            Instant createdAt,
            Instant revokedAt
    ) {
        static LinkView of(SharedLink l, String publicUrl, LinkStatus status) {
            return new LinkView(l.shareId(), l.target().kind().name().toLowerCase(Locale.ROOT),
                    l.target().id(), l.name(), l.description(), publicUrl, status, l.requiresAuthentication(),
                    l.hasPassword(), l.expiresAt(), l.maxUses(), l.currentUses(), l.allowedUsers(), l.createdBy(),
                    l.createdAt(), l.revokedAt());
        }
    }

    public record StatusView(String shareId, LinkStatus status) {}

    public record DeletedConnector(String id, int linksRevoked) {}

    /** Durable counters from the store plus in-memory counters since process start. */
    public record UsageView(
            String id,
            long totalRequests,
            Instant lastAccessedAt,
            long succeeded,
            long rejected,
            long failed,
            long bytes
    ) {
        static UsageView of(String id, long total, Instant lastAccessedAt, UsageStats.Snapshot s) {
            if (s == null) {
                return new UsageView(id, total, lastAccessedAt, 0, 0, 0, 0);
            }
            return new UsageView(id, total, lastAccessedAt == null ? s.lastAccess() : lastAccessedAt,
                    s.succeeded(), s.rejected(), s.failed(), s.bytes());
        }
    }

    public record ErrorView(String error, String message) {}
}
