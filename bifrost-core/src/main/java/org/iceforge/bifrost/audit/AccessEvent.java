package org.iceforge.bifrost.audit;

import org.iceforge.bifrost.error.ErrorCode;

import java.time.Instant;

/**
 * One proxied request as it is written to the audit trail.
 *
 * <p>{@code connectorId} and {@code shareId} are both set when a request went through a
 * link; {@code shareId} alone identifies a dataset link. {@code caller} is the verified
 * subject or {@code anonymous}.
 */
public record AccessEvent(
        Instant timestamp,
        String protocol,
        String connectorId,
        String shareId,
        String operation,
        Outcome outcome,
        ErrorCode errorCode,
        String caller,
        String remoteAddress,
        long latencyMillis,
        long bytes
) {
    public static final String ANONYMOUS = "anonymous";

    public enum Outcome { SUCCEEDED, REJECTED, FAILED }

    public AccessEvent {
        caller = caller == null || caller.isBlank() ? ANONYMOUS : caller;
    }

    /** Key the event is accounted under: the link when there is one, else the connector. */
    public String subjectId() {
        return shareId != null ? shareId : connectorId;
    }
}
