package org.iceforge.bifrost.gateway.config;

import org.iceforge.bifrost.pipeline.Protocol;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Listener, timeout and limit settings of the gateway.
 *
 * <p>Listeners are keyed by {@link Protocol#id()}; a protocol without an entry is enabled on
 * its default port.
 */
@ConfigurationProperties(prefix = "bifrost.gateway")
public record GatewayProperties(
        Map<String, Listener> listeners,
        Timeouts timeouts,
        Long maxResponseBytes,
        Pool pool,
        String advertisedHost,
        String publicBaseUrl,
        Map<String, Dataset> datasets
) {
    public static final long DEFAULT_MAX_RESPONSE_BYTES = 10L * 1024 * 1024;

    public GatewayProperties {
        listeners = listeners == null ? Map.of() : Map.copyOf(listeners);
        timeouts = timeouts == null ? new Timeouts(null, null, null, null, null, null) : timeouts;
        maxResponseBytes = maxResponseBytes == null || maxResponseBytes <= 0 ? DEFAULT_MAX_RESPONSE_BYTES : maxResponseBytes;
        pool = pool == null ? new Pool(null, null) : pool;
        advertisedHost = advertisedHost == null || advertisedHost.isBlank() ? "localhost" : advertisedHost;
        datasets = datasets == null ? Map.of() : Map.copyOf(datasets);
    }

    public Listener listener(Protocol protocol) {
        Listener l = listeners.get(protocol.id());
        if (l == null) {
            return new Listener(true, "0.0.0.0", protocol.defaultPort());
        }
        return new Listener(l.enabled(), l.host(), l.port() == null ? protocol.defaultPort() : l.port());
    }

    /** Base URL shared links are rendered under; defaults to the shared listener on the advertised host. */
    public String publicBaseUrlOrDefault() {
        if (publicBaseUrl != null && !publicBaseUrl.isBlank()) {
            return publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        }
        return "http://" + advertisedHost + ":" + listener(Protocol.SHARED).port();
    }

    public record Listener(Boolean enabled, String host, Integer port) {
        public Listener {
            enabled = enabled == null || enabled;
            host = host == null || host.isBlank() ? "0.0.0.0" : host;
        }
    }

    public record Timeouts(
            Duration handshake,
            Duration poolAcquire,
            Duration backendResponse,
            Duration shutdownGrace,
            Duration retryBackoff,
            Duration idle
    ) {
        public Timeouts {
            handshake = handshake == null ? Duration.ofSeconds(10) : handshake;
            poolAcquire = poolAcquire == null ? Duration.ofSeconds(10) : poolAcquire;
            backendResponse = backendResponse == null ? Duration.ofSeconds(30) : backendResponse;
            shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(10) : shutdownGrace;
            retryBackoff = retryBackoff == null ? Duration.ofMillis(200) : retryBackoff;
            idle = idle == null ? Duration.ofMinutes(30) : idle;
        }
    }

    /** Per-connector backend pool sizing. */
    public record Pool(Integer maxSize, Duration idleTimeout) {
        public Pool {
            maxSize = maxSize == null || maxSize <= 0 ? 10 : maxSize;
            idleTimeout = idleTimeout == null ? Duration.ofMinutes(10) : idleTimeout;
        }
    }

    /** A dataset that dataset links may point at. */
    public record Dataset(String name, String description, String format, String location) {
    }
}
