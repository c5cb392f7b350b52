package org.iceforge.bifrost.store;

import org.iceforge.bifrost.model.ProxyConnector;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Durable home of {@link ProxyConnector} rows. Lookups return revoked rows too. */
public interface ConnectorStore {

    void insert(ProxyConnector connector);

    Optional<ProxyConnector> findById(String id);

    Optional<ProxyConnector> findByAccessToken(String accessToken);

    /** Live connectors of one owner, newest first. */
    List<ProxyConnector> findByOwner(String ownerId);

    /** Rewrites the mutable columns of a live connector. Returns false when it is gone or revoked. */
    boolean update(ProxyConnector connector);

    /**
     * Atomically adds one to {@code total_requests} and stamps {@code last_accessed_at}.
     * Returns false if the connector is revoked.
     */
    boolean incrementRequests(String id, Instant at);

    /**
     * Revokes the connector and every link that targets it in one transaction.
     * Returns the number of links revoked, or -1 when the connector was already revoked or unknown.
     */
    int revokeCascade(String id, Instant at);
}
