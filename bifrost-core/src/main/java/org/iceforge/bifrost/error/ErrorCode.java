package org.iceforge.bifrost.error;

/**
 * Every way a proxied request or an admin call can fail.
 *
 * <p>Authorization failures are reported to the client with a generic message; the
 * exact code only reaches logs and the audit trail.
 */
public enum ErrorCode {
    TOKEN_NOT_FOUND(true),
    TOKEN_EXPIRED(true),
    TOKEN_EXHAUSTED(true),
    TOKEN_REVOKED(true),
    OPERATION_NOT_ALLOWED(true),
    PASSWORD_REQUIRED(true),
    PASSWORD_INCORRECT(true),
    AUTHENTICATION_REQUIRED(true),
    CALLER_NOT_ALLOWED(true),
    CONNECTOR_UNAVAILABLE(false),
    BACKEND_UNREACHABLE(false),
    BACKEND_TIMEOUT(false),
    RESPONSE_TOO_LARGE(false),
    MALFORMED_REQUEST(false),
    CONNECTOR_NOT_FOUND(false),
    LINK_NOT_FOUND(false),
    INVALID_ARGUMENT(false);

    private final boolean authorizationFailure;

    ErrorCode(boolean authorizationFailure) {
        this.authorizationFailure = authorizationFailure;
    }

    public boolean isAuthorizationFailure() {
        return authorizationFailure;
    }

    /** Transient backend conditions that a read-only request may be retried on. */
    public boolean isTransient() {
        return this == BACKEND_UNREACHABLE || this == BACKEND_TIMEOUT;
    }

    /** Message safe to show to an unauthenticated client. */
    public String publicMessage() {
        return switch (this) {
            case PASSWORD_REQUIRED -> "password required";
            case PASSWORD_INCORRECT, AUTHENTICATION_REQUIRED, CALLER_NOT_ALLOWED,
                 TOKEN_NOT_FOUND, TOKEN_EXPIRED, TOKEN_EXHAUSTED, TOKEN_REVOKED -> "access denied";
            case OPERATION_NOT_ALLOWED -> "operation not permitted";
            case CONNECTOR_UNAVAILABLE -> "connector unavailable";
            case BACKEND_UNREACHABLE -> "backend unreachable";
            case BACKEND_TIMEOUT -> "backend timed out";
            case RESPONSE_TOO_LARGE -> "backend response exceeds the size limit";
            case MALFORMED_REQUEST -> "malformed request";
            case CONNECTOR_NOT_FOUND -> "connector not found";
            case LINK_NOT_FOUND -> "shared link not found";
            case INVALID_ARGUMENT -> "invalid argument";
        };
    }
}
