package org.iceforge.bifrost.error;

import java.util.Objects;

/**
 * Raised for every failure the gateway reports to a client or an owner.
 *
 * <p>The message is for logs. Listeners render {@link ErrorCode#publicMessage()} instead.
 */
public class GatewayException extends RuntimeException {
    private final ErrorCode code;

    public GatewayException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public GatewayException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public static GatewayException of(ErrorCode code) {
        return new GatewayException(code, code.publicMessage());
    }

    public ErrorCode code() {
        return code;
    }

    @Override
    public String toString() {
        return "GatewayException[" + code + "]: " + getMessage();
    }
}
