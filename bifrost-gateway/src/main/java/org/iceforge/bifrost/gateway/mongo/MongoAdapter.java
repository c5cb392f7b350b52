package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProtocolAdapter;
import org.iceforge.bifrost.token.ClientCredentials;

import java.util.Locale;
import java.util.Set;

/** Document-store commands; the operation is the command name. */
public final class MongoAdapter implements ProtocolAdapter<MongoRequest, BsonDocument, MongoOutput> {

    static final Set<String> READ_ONLY = Set.of(
            "FIND", "AGGREGATE", "COUNT", "DISTINCT", "LISTCOLLECTIONS", "LISTINDEXES", "LISTDATABASES",
            "DBSTATS", "COLLSTATS", "EXPLAIN");

    /** An aggregate whose pipeline ends in {@code $out} or {@code $merge}; it writes a collection. */
    public static final String AGGREGATE_WRITE = "AGGREGATE_WRITE";

    private static final Set<String> WRITING_STAGES = Set.of("$out", "$merge");

    private final long maxResponseBytes;

    MongoAdapter(long maxResponseBytes) {
        this.maxResponseBytes = maxResponseBytes;
    }

    @Override
    public Protocol protocol() {
        return Protocol.MONGODB;
    }

    @Override
    public ClientCredentials parseToken(MongoRequest request) {
        return request.credentials();
    }

    @Override
    public String parseOperation(MongoRequest request) {
        return request.operation();
    }

    @Override
    public boolean isReadOnly(String operation) {
        return isReadOnlyCommand(operation);
    }

    public static boolean isReadOnlyCommand(String operation) {
        return READ_ONLY.contains(operation);
    }

    /** Operation name a command is authorized as: its name, upper-cased, or {@link #AGGREGATE_WRITE}. */
    public static String commandOperation(String name, BsonDocument command) {
        String op = name.toUpperCase(Locale.ROOT);
        if (op.equals("AGGREGATE") && writesCollection(command.get("pipeline"))) {
            return AGGREGATE_WRITE;
        }
        return op;
    }

    private static boolean writesCollection(BsonValue pipeline) {
        if (pipeline == null || !pipeline.isArray()) return false;
        for (BsonValue stage : pipeline.asArray()) {
            if (stage.isDocument() && stage.asDocument().keySet().stream().anyMatch(WRITING_STAGES::contains)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public long frameResponse(BsonDocument reply, MongoOutput out) {
        long size = MongoWire.encode(reply).length;
        if (size > maxResponseBytes) {
            frameError(new GatewayException(ErrorCode.RESPONSE_TOO_LARGE,
                    "reply of " + size + " bytes exceeds " + maxResponseBytes), out);
            return 0;
        }
        out.reply = reply;
        return size;
    }

    @Override
    public void frameError(GatewayException error, MongoOutput out) {
        out.reply = MongoErrors.of(error.code());
    }
}
