package org.iceforge.bifrost.audit;

/** Operator-facing alarms for conditions that need a human, such as an undecryptable connector. */
public interface AlertSink {

    void raise(String component, String subjectId, String message, Throwable cause);
}
