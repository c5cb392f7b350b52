package org.iceforge.bifrost.gateway.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;

import java.util.Map;

/** Error code to HTTP status, and the JSON error body every HTTP listener returns. */
public final class HttpErrors {
    private HttpErrors() {}

    public static int status(ErrorCode code) {
        return switch (code) {
            case PASSWORD_REQUIRED, AUTHENTICATION_REQUIRED -> 401;
            case TOKEN_NOT_FOUND, TOKEN_EXPIRED, TOKEN_EXHAUSTED, TOKEN_REVOKED, PASSWORD_INCORRECT,
                 CALLER_NOT_ALLOWED, OPERATION_NOT_ALLOWED -> 403;
            case CONNECTOR_UNAVAILABLE -> 503;
            case BACKEND_UNREACHABLE, RESPONSE_TOO_LARGE -> 502;
            case BACKEND_TIMEOUT -> 504;
            case MALFORMED_REQUEST, INVALID_ARGUMENT -> 400;
            case CONNECTOR_NOT_FOUND, LINK_NOT_FOUND -> 404;
        };
    }

    /** Only the public message is sent; the precise denial reason stays in the audit trail. */
    public static void write(HttpReply reply, GatewayException error, ObjectMapper mapper) {
        reply.json(mapper, status(error.code()), Map.of("error", error.code().publicMessage()));
    }
}
