package org.iceforge.bifrost.pipeline.backend;

import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.iceforge.bifrost.vault.CredentialHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * One backend client or connection pool per connector id.
 *
 * <p>A pool is built the first time a request for its connector is authorized; secrets are
 * opened once for that and not kept. Pools are evicted when the connector is updated or revoked.
 *
 * @param <P> pool type, closed on eviction
 */
public final class BackendPools<P extends AutoCloseable> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackendPools.class);

    private final String kind;
    private final BiFunction<String, ConnectorSecrets, P> factory;
    private final ConcurrentHashMap<String, P> pools = new ConcurrentHashMap<>();

    /**
     * @param kind    label for logs, e.g. {@code jdbc} or {@code s3}
     * @param factory builds a pool from the connector id and its opened secrets
     */
    public BackendPools(String kind, BiFunction<String, ConnectorSecrets, P> factory) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public P acquire(CredentialHandle handle) {
        Objects.requireNonNull(handle, "handle");
        return pools.computeIfAbsent(handle.connectorId(), id -> {
            P pool = handle.withSecrets(secrets -> factory.apply(id, secrets));
            log.info("Opened {} backend pool for connector {}", kind, id);
            return pool;
        });
    }

    public void evict(String connectorId) {
        P pool = pools.remove(connectorId);
        if (pool != null) {
            closeQuietly(connectorId, pool);
            log.info("Evicted {} backend pool for connector {}", kind, connectorId);
        }
    }

    public int size() {
        return pools.size();
    }

    @Override
    public void close() {
        pools.forEach((id, pool) -> closeQuietly(id, pool));
        pools.clear();
    }

    private void closeQuietly(String connectorId, P pool) {
        try {
            pool.close();
        } catch (Exception e) {
            log.warn("Failed to close {} backend pool for connector {}", kind, connectorId, e);
        }
    }
}
