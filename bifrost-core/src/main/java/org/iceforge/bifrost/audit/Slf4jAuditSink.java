package org.iceforge.bifrost.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes one line per request to the {@code bifrost.audit} logger. */
public final class Slf4jAuditSink implements AuditSink {
    public static final String LOGGER_NAME = "bifrost.audit";

    private final Logger log;

    public Slf4jAuditSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    Slf4jAuditSink(Logger log) {
        this.log = log;
    }

    @Override
    public void append(AccessEvent e) {
        if (e == null) return;
        if (e.outcome() == AccessEvent.Outcome.SUCCEEDED) {
            log.info("protocol={} connector={} link={} op={} outcome={} caller={} remote={} latencyMs={} bytes={}",
                    e.protocol(), e.connectorId(), e.shareId(), e.operation(), e.outcome(),
                    e.caller(), e.remoteAddress(), e.latencyMillis(), e.bytes());
        } else {
            log.warn("protocol={} connector={} link={} op={} outcome={} code={} caller={} remote={} latencyMs={}",
                    e.protocol(), e.connectorId(), e.shareId(), e.operation(), e.outcome(), e.errorCode(),
                    e.caller(), e.remoteAddress(), e.latencyMillis());
        }
    }
}
