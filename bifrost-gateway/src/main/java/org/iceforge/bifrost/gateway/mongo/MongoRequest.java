package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonDocument;
import org.iceforge.bifrost.token.ClientCredentials;

/**
 * One command bound for a document-store backend.
 *
 * @param operation allow-list name: the command name upper-cased, or the originating
 *                  operation for cursor continuation commands
 */
public record MongoRequest(ClientCredentials credentials, String database, BsonDocument command, String operation,
                           MongoSessions sessions) {
}
