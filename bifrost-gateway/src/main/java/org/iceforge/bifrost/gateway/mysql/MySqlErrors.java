package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.error.ErrorCode;

/** Gateway error codes as MySQL server error numbers and SQLSTATEs. */
final class MySqlErrors {
    static final int ER_ACCESS_DENIED = 1045;
    static final int ER_TABLEACCESS_DENIED = 1142;
    static final int ER_NET_READ_ERROR = 1158;
    static final int ER_NET_PACKET_TOO_LARGE = 1153;
    static final int ER_QUERY_TIMEOUT = 3024;
    static final int ER_UNKNOWN_COM = 1047;
    static final int ER_UNSUPPORTED_PS = 1295;
    static final int ER_WRONG_ARGUMENTS = 1210;
    static final int ER_UNKNOWN = 1105;

    record Native(int errno, String sqlState) {
    }

    private MySqlErrors() {
    }

    static Native of(ErrorCode code) {
        if (code.isAuthorizationFailure() && code != ErrorCode.OPERATION_NOT_ALLOWED) {
            return new Native(ER_ACCESS_DENIED, "28000");
        }
        return switch (code) {
            case OPERATION_NOT_ALLOWED -> new Native(ER_TABLEACCESS_DENIED, "42000");
            case BACKEND_UNREACHABLE -> new Native(ER_NET_READ_ERROR, "08S01");
            case BACKEND_TIMEOUT -> new Native(ER_QUERY_TIMEOUT, "HY000");
            case RESPONSE_TOO_LARGE -> new Native(ER_NET_PACKET_TOO_LARGE, "08S01");
            case MALFORMED_REQUEST -> new Native(ER_UNKNOWN_COM, "08S01");
            case INVALID_ARGUMENT -> new Native(ER_WRONG_ARGUMENTS, "HY000");
            default -> new Native(ER_UNKNOWN, "HY000");
        };
    }
}
