package org.iceforge.bifrost.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.LongAdder;

/** Raises alerts as ERROR lines on the {@code bifrost.alert} logger. */
public final class LoggingAlertSink implements AlertSink {
    private static final Logger log = LoggerFactory.getLogger("bifrost.alert");

    private final LongAdder raised = new LongAdder();

    @Override
    public void raise(String component, String subjectId, String message, Throwable cause) {
        raised.increment();
        // Cause class only: crypto exception messages can echo input material.
        log.error("ALERT component={} subject={} message={} cause={}", component, subjectId, message,
                cause == null ? "-" : cause.getClass().getName());
    }

    public long raisedCount() {
        return raised.sum();
    }
}
