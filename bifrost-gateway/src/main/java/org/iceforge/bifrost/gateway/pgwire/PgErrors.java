package org.iceforge.bifrost.gateway.pgwire;

import org.iceforge.bifrost.error.ErrorCode;

/** SQLSTATE for each gateway error code. */
final class PgErrors {
    private PgErrors() {}

    static String sqlState(ErrorCode code) {
        return switch (code) {
            case PASSWORD_REQUIRED, PASSWORD_INCORRECT -> "28P01";
            case TOKEN_NOT_FOUND, TOKEN_EXPIRED, TOKEN_EXHAUSTED, TOKEN_REVOKED,
                 AUTHENTICATION_REQUIRED, CALLER_NOT_ALLOWED -> "28000";
            case OPERATION_NOT_ALLOWED -> "42501";
            case CONNECTOR_UNAVAILABLE -> "08001";
            case BACKEND_UNREACHABLE -> "08006";
            case BACKEND_TIMEOUT -> "57014";
            case RESPONSE_TOO_LARGE -> "54000";
            case MALFORMED_REQUEST -> "08P01";
            case INVALID_ARGUMENT -> "22023";
            case CONNECTOR_NOT_FOUND, LINK_NOT_FOUND -> "XX000";
        };
    }
}
