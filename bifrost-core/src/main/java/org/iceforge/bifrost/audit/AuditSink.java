package org.iceforge.bifrost.audit;

import java.util.List;

/** Receives one event per proxied request. Implementations must not block the caller for long. */
public interface AuditSink {

    void append(AccessEvent event);

    static AuditSink composite(List<? extends AuditSink> sinks) {
        List<AuditSink> copy = List.copyOf(sinks);
        return event -> {
            for (AuditSink sink : copy) {
                sink.append(event);
            }
        };
    }
}
