package org.iceforge.bifrost.gateway.listener;

import org.iceforge.bifrost.pipeline.Protocol;

import java.io.IOException;
import java.time.Duration;

/** One network endpoint speaking one client protocol. */
public interface ProtocolListener {

    Protocol protocol();

    void start() throws IOException;

    /**
     * Stops accepting, lets in-flight requests finish for up to {@code grace}, then closes
     * whatever is still open.
     */
    void stop(Duration grace);

    boolean isRunning();

    /** Bound port, or 0 when not running. */
    int localPort();

    int activeSessions();
}
