package org.iceforge.bifrost.error;

/** Client input the listener could not parse; the connection is closed after reporting it. */
public class MalformedRequestException extends GatewayException {

    public MalformedRequestException(String message) {
        super(ErrorCode.MALFORMED_REQUEST, message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_REQUEST, message, cause);
    }
}
