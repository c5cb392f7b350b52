package org.iceforge.bifrost.gateway.listener;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.pipeline.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts and stops every enabled protocol listener with the application context.
 *
 * <p>Listeners start independently: one that fails to bind is logged and reported as failed
 * while the others keep serving.
 */
@Component
public class ListenerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ListenerLifecycle.class);

    public enum State { DISABLED, RUNNING, FAILED, STOPPED }

    public record Status(Protocol protocol, State state, String host, int port, int activeSessions, String error) {}

    private final Map<Protocol, ProtocolListener> listeners = new EnumMap<>(Protocol.class);
    private final Map<Protocol, String> failures = new ConcurrentHashMap<>();
    private final GatewayProperties props;
    private volatile boolean running;

    public ListenerLifecycle(List<ProtocolListener> listeners, GatewayProperties props) {
        this.props = Objects.requireNonNull(props, "props");
        for (ProtocolListener l : listeners) {
            ProtocolListener previous = this.listeners.put(l.protocol(), l);
            if (previous != null) {
                throw new IllegalStateException("Two listeners registered for " + l.protocol().id());
            }
        }
    }

    @Override
    public void start() {
        for (ProtocolListener l : listeners.values()) {
            Protocol p = l.protocol();
            if (!props.listener(p).enabled()) {
                log.info("{} listener disabled", p.id());
                continue;
            }
            try {
                l.start();
                failures.remove(p);
            } catch (IOException | RuntimeException e) {
                failures.put(p, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                log.error("{} listener failed to start on {}:{}", p.id(), props.listener(p).host(),
                        props.listener(p).port(), e);
            }
        }
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        Duration grace = props.timeouts().shutdownGrace();
        for (ProtocolListener l : listeners.values()) {
            if (l.isRunning()) {
                l.stop(grace);
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    public Optional<ProtocolListener> listener(Protocol protocol) {
        return Optional.ofNullable(listeners.get(protocol));
    }

    /** Bound port of a running listener, or 0. */
    public int port(Protocol protocol) {
        return listener(protocol).map(ProtocolListener::localPort).orElse(0);
    }

    public List<Status> statuses() {
        List<Status> out = new ArrayList<>();
        for (Protocol p : Protocol.values()) {
            GatewayProperties.Listener cfg = props.listener(p);
            ProtocolListener l = listeners.get(p);
            State state;
            if (l == null || !cfg.enabled()) {
                state = State.DISABLED;
            } else if (l.isRunning()) {
                state = State.RUNNING;
            } else if (failures.containsKey(p)) {
                state = State.FAILED;
            } else {
                state = State.STOPPED;
            }
            int port = l != null && l.isRunning() ? l.localPort() : cfg.port();
            out.add(new Status(p, state, cfg.host(), port, l == null ? 0 : l.activeSessions(), failures.get(p)));
        }
        return out;
    }
}
