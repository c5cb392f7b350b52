package org.iceforge.bifrost.gateway.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.vault.ConnectorSecrets;

import java.util.concurrent.TimeUnit;

/**
 * {@code connection_string} when present, else {@code host}/{@code port}. Credentials in
 * {@code username}/{@code password} are applied against {@code auth_source} (default
 * {@code admin}) unless the connection string already carries them.
 */
public final class DriverMongoClientFactory implements MongoClientFactory {

    private final GatewayProperties props;

    public DriverMongoClientFactory(GatewayProperties props) {
        this.props = props;
    }

    @Override
    public MongoClient create(ConnectorSecrets secrets) {
        String uri = secrets.get("connection_string").orElseGet(() ->
                "mongodb://" + secrets.require("host") + ":" + secrets.getInt("port", 27017)
                        + (secrets.getBoolean("ssl", false) ? "/?tls=true" : ""));
        ConnectionString cs = new ConnectionString(uri);
        GatewayProperties.Timeouts t = props.timeouts();

        MongoClientSettings.Builder builder = MongoClientSettings.builder()
                .applyConnectionString(cs)
                .applyToClusterSettings(b -> b.serverSelectionTimeout(t.poolAcquire().toMillis(), TimeUnit.MILLISECONDS))
                .applyToSocketSettings(b -> b
                        .connectTimeout((int) t.poolAcquire().toMillis(), TimeUnit.MILLISECONDS)
                        .readTimeout((int) t.backendResponse().toMillis(), TimeUnit.MILLISECONDS))
                .applyToConnectionPoolSettings(b -> b
                        .maxSize(secrets.getInt("max_pool_size", props.pool().maxSize()))
                        .maxWaitTime(t.poolAcquire().toMillis(), TimeUnit.MILLISECONDS)
                        .maxConnectionIdleTime(props.pool().idleTimeout().toMillis(), TimeUnit.MILLISECONDS));

        if (cs.getCredential() == null && secrets.get("username").isPresent()) {
            builder.credential(MongoCredential.createCredential(
                    secrets.require("username"),
                    secrets.getOrDefault("auth_source", "admin"),
                    secrets.getOrDefault("password", "").toCharArray()));
        }
        return MongoClients.create(builder.build());
    }
}
