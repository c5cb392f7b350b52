package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.iceforge.bifrost.error.ErrorCode;

/** Gateway errors as MongoDB command failures. */
final class MongoErrors {
    static final int UNAUTHORIZED = 13;
    static final int AUTHENTICATION_FAILED = 18;
    static final int COMMAND_NOT_FOUND = 59;

    private MongoErrors() {
    }

    static BsonDocument of(ErrorCode code) {
        if (code.isAuthorizationFailure()) {
            return failure(UNAUTHORIZED, "Unauthorized", code.publicMessage());
        }
        return switch (code) {
            case BACKEND_UNREACHABLE, CONNECTOR_UNAVAILABLE -> failure(6, "HostUnreachable", code.publicMessage());
            case BACKEND_TIMEOUT -> failure(50, "MaxTimeMSExpired", code.publicMessage());
            case RESPONSE_TOO_LARGE -> failure(10334, "BSONObjectTooLarge", code.publicMessage());
            case MALFORMED_REQUEST -> failure(9, "FailedToParse", code.publicMessage());
            case INVALID_ARGUMENT -> failure(2, "BadValue", code.publicMessage());
            default -> failure(1, "InternalError", code.publicMessage());
        };
    }

    static BsonDocument failure(int code, String codeName, String message) {
        return new BsonDocument("ok", new BsonDouble(0))
                .append("errmsg", new BsonString(message))
                .append("code", new BsonInt32(code))
                .append("codeName", new BsonString(codeName));
    }
}
