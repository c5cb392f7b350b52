package org.iceforge.bifrost.gateway.mongo;

import com.mongodb.client.MongoClient;
import org.iceforge.bifrost.vault.ConnectorSecrets;

/** Builds the driver client of one document-store connector. */
@FunctionalInterface
public interface MongoClientFactory {

    MongoClient create(ConnectorSecrets secrets);
}
