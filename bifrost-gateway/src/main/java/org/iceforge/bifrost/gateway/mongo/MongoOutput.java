package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonDocument;

/** Receives the reply document of one proxied command. */
final class MongoOutput {
    BsonDocument reply;
}
