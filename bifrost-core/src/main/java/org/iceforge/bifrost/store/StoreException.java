package org.iceforge.bifrost.store;

/** The durable store failed; wraps the driver exception. */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
