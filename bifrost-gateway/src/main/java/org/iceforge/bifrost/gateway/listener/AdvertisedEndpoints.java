package org.iceforge.bifrost.gateway.listener;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.pipeline.Protocol;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/** Host and port clients are told to connect to for each listener. */
@Component
public class AdvertisedEndpoints {

    private final GatewayProperties props;
    private final ObjectProvider<ListenerLifecycle> listeners;

    public AdvertisedEndpoints(GatewayProperties props, ObjectProvider<ListenerLifecycle> listeners) {
        this.props = props;
        this.listeners = listeners;
    }

    public String host() {
        return props.advertisedHost();
    }

    /** The bound port while the listener runs, otherwise the configured one. */
    public int port(Protocol protocol) {
        ListenerLifecycle lifecycle = listeners.getIfAvailable();
        int bound = lifecycle == null ? 0 : lifecycle.port(protocol);
        return bound > 0 ? bound : props.listener(protocol).port();
    }

    public String hostPort(Protocol protocol) {
        return host() + ":" + port(protocol);
    }

    /** Base URL for rendering shared links. */
    public String publicBaseUrl() {
        String configured = props.publicBaseUrl();
        if (configured != null && !configured.isBlank()) {
            return props.publicBaseUrlOrDefault();
        }
        return "http://" + hostPort(Protocol.SHARED);
    }
}
