package org.iceforge.bifrost.registry;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.EncryptedBlob;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.store.ConnectorStore;
import org.iceforge.bifrost.token.TokenGenerator;
import org.iceforge.bifrost.vault.CredentialVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owner-facing connector lifecycle plus the cached lookups the token resolver runs on every request.
 *
 * <p>Writes go straight to the store and drop the cached copy. Listeners registered through
 * {@link #onInvalidate} hear about every update and revocation so they can drop backend pools.
 */
public class ConnectorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final ConnectorStore store;
    private final CredentialVault vault;
    private final TokenGenerator tokens;
    private final Clock clock;
    private final ConnectorCache cache;
    private final List<Consumer<String>> invalidationListeners = new CopyOnWriteArrayList<>();

    public ConnectorRegistry(ConnectorStore store, CredentialVault vault, TokenGenerator tokens,
                             Clock clock, Duration cacheTtl) {
        this.store = Objects.requireNonNull(store, "store");
        this.vault = Objects.requireNonNull(vault, "vault");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cache = new ConnectorCache(clock, cacheTtl);
    }

    public ProxyConnector register(NewConnector req) {
        Objects.requireNonNull(req, "request");
        requireText(req.ownerId(), "ownerId");
        requireText(req.name(), "name");
        if (req.type() == null) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "type is required");
        }
        if (req.secrets() == null || req.secrets().keys().isEmpty()) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "connection config is required");
        }

        String id = tokens.connectorId();
        Set<String> ops = normalize(req.allowedOperations(), req.type());
        EncryptedBlob blob = vault.encrypt(id, req.secrets());
        ProxyConnector connector = new ProxyConnector(id, req.ownerId(), req.name().trim(), req.description(),
                req.type(), tokens.accessToken(), blob, ops, req.visibleToOthers(), 0L,
                clock.instant(), null, null, null);
        store.insert(connector);
        log.info("Registered connector id={} owner={} type={} ops={}", id, req.ownerId(), req.type().wireName(), ops);
        return connector;
    }

    public ProxyConnector update(String ownerId, String id, ConnectorUpdate upd) {
        Objects.requireNonNull(upd, "update");
        ProxyConnector current = get(ownerId, id);

        EncryptedBlob blob = upd.secrets() == null ? current.credentials() : vault.encrypt(id, upd.secrets());
        Set<String> ops = upd.allowedOperations() == null
                ? current.allowedOperations()
                : normalize(upd.allowedOperations(), current.type());
        ProxyConnector updated = new ProxyConnector(
                current.id(), current.ownerId(),
                upd.name() == null || upd.name().isBlank() ? current.name() : upd.name().trim(),
                upd.description() == null ? current.description() : upd.description(),
                current.type(), current.accessToken(), blob, ops,
                upd.visibleToOthers() == null ? current.visibleToOthers() : upd.visibleToOthers(),
                current.totalRequests(), current.createdAt(), clock.instant(), current.lastAccessedAt(), null);
        if (!store.update(updated)) {
            throw new GatewayException(ErrorCode.CONNECTOR_NOT_FOUND, "connector " + id + " is gone");
        }
        invalidate(current);
        log.info("Updated connector id={} secretsChanged={}", id, upd.secrets() != null);
        return updated;
    }

    public List<ProxyConnector> listForOwner(String ownerId) {
        requireText(ownerId, "ownerId");
        return store.findByOwner(ownerId);
    }

    /** Live connector owned by {@code ownerId}; anything else is reported as not found. */
    public ProxyConnector get(String ownerId, String id) {
        return store.findById(id)
                .filter(c -> c.ownerId().equals(ownerId))
                .filter(c -> !c.isRevoked())
                .orElseThrow(() -> new GatewayException(ErrorCode.CONNECTOR_NOT_FOUND, "connector " + id + " not found"));
    }

    /** Cached lookup by id. Revoked connectors are returned so callers can tell revoked from unknown. */
    public Optional<ProxyConnector> resolve(String id) {
        Optional<ProxyConnector> hit = cache.byId(id);
        if (hit.isPresent()) return hit;
        Optional<ProxyConnector> loaded = store.findById(id);
        loaded.ifPresent(cache::put);
        return loaded;
    }

    /** Cached lookup by direct access token. */
    public Optional<ProxyConnector> resolveByToken(String accessToken) {
        Optional<ProxyConnector> hit = cache.byToken(accessToken);
        if (hit.isPresent()) return hit;
        Optional<ProxyConnector> loaded = store.findByAccessToken(accessToken);
        loaded.ifPresent(cache::put);
        return loaded;
    }

    /**
     * Soft-deletes the connector and revokes every link that targets it.
     *
     * @return number of links revoked with it
     */
    public int delete(String ownerId, String id) {
        ProxyConnector current = get(ownerId, id);
        int links = store.revokeCascade(id, clock.instant());
        if (links < 0) {
            throw new GatewayException(ErrorCode.CONNECTOR_NOT_FOUND, "connector " + id + " not found");
        }
        invalidate(current);
        log.info("Revoked connector id={} owner={} linksRevoked={}", id, ownerId, links);
        return links;
    }

    /** Counts one request against the connector. Returns false once it is revoked. */
    public boolean recordRequest(String id, Instant at) {
        return store.incrementRequests(id, at);
    }

    public void onInvalidate(Consumer<String> listener) {
        invalidationListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void invalidate(ProxyConnector c) {
        cache.invalidate(c);
        for (Consumer<String> l : invalidationListeners) {
            try {
                l.accept(c.id());
            } catch (RuntimeException e) {
                log.warn("Invalidation listener failed for connector {}", c.id(), e);
            }
        }
    }

    private static Set<String> normalize(Set<String> requested, ConnectorType type) {
        if (requested == null || requested.isEmpty()) {
            return type.defaultOperations();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String op : requested) {
            String n = ConnectorType.normalizeOperation(op);
            if (!n.isEmpty()) out.add(n);
        }
        return out.isEmpty() ? type.defaultOperations() : out;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, field + " is required");
        }
    }
}
