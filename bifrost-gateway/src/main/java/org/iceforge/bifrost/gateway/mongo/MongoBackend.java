package org.iceforge.bifrost.gateway.mongo;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import org.bson.BsonDocument;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.pipeline.backend.BackendPools;
import org.iceforge.bifrost.token.AuthorizationResult;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs commands on document-store connectors. A connector with a {@code database} setting
 * is confined to that database whatever the client names.
 *
 * <p>Command failures the server reports are returned as their reply documents.
 */
public class MongoBackend implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MongoBackend.class);

    private final BackendPools<Target> pools;

    record Target(MongoClient client, String database) implements AutoCloseable {
        @Override
        public void close() {
            client.close();
        }
    }

    public MongoBackend(MongoClientFactory clients) {
        Objects.requireNonNull(clients, "clients");
        this.pools = new BackendPools<>("mongodb", (id, secrets) -> open(clients, secrets));
    }

    private static Target open(MongoClientFactory clients, ConnectorSecrets secrets) {
        return new Target(clients.create(secrets), secrets.get("database").orElse(null));
    }

    public BsonDocument run(MongoRequest request, AuthorizationResult grant) {
        Target target = pools.acquire(grant.credentials());
        String db = target.database() != null ? target.database() : request.database();
        try {
            ClientSession session = request.sessions().get(grant.connectorId(), target.client());
            return target.client().getDatabase(db).runCommand(session, request.command(), BsonDocument.class);
        } catch (MongoCommandException e) {
            log.debug("Command {} on connector {} failed: {}", request.operation(), grant.connectorId(),
                    e.getErrorCodeName());
            return e.getResponse();
        } catch (MongoExecutionTimeoutException | MongoSocketReadTimeoutException e) {
            throw new GatewayException(ErrorCode.BACKEND_TIMEOUT, "document store timed out", e);
        } catch (MongoTimeoutException | MongoSocketException e) {
            throw new GatewayException(ErrorCode.BACKEND_UNREACHABLE, "document store unreachable: " + e.getMessage(), e);
        } catch (MongoException e) {
            throw new GatewayException(ErrorCode.BACKEND_UNREACHABLE, "document store error: " + e.getMessage(), e);
        }
    }

    public void evict(String connectorId) {
        pools.evict(connectorId);
    }

    @Override
    public void close() {
        pools.close();
    }
}
