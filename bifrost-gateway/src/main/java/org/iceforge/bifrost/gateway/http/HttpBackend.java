package org.iceforge.bifrost.gateway.http;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutException;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.pipeline.backend.BackendPools;
import org.iceforge.bifrost.token.AuthorizationResult;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Forwards requests to HTTP backends (generic APIs, the ClickHouse HTTP interface) with the
 * connector's credentials injected. One WebClient and connection pool per connector.
 *
 * <p>Responses are buffered up to the configured size limit.
 */
public class HttpBackend implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HttpBackend.class);
    private static final byte[] EMPTY = new byte[0];

    private final String kind;
    private final Function<ConnectorSecrets, HttpEndpoint> endpoints;
    private final WebClient.Builder builder;
    private final GatewayProperties props;
    private final BackendPools<Client> pools;

    /** One connector's client; the provider is disposed with it. */
    record Client(WebClient web, HttpEndpoint endpoint, ConnectionProvider provider) implements AutoCloseable {
        @Override
        public void close() {
            provider.dispose();
        }
    }

    public HttpBackend(String kind, Function<ConnectorSecrets, HttpEndpoint> endpoints, WebClient.Builder builder,
                       GatewayProperties props) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.props = Objects.requireNonNull(props, "props");
        this.pools = new BackendPools<>("http-" + kind, this::openClient);
    }

    private Client openClient(String connectorId, ConnectorSecrets secrets) {
        HttpEndpoint endpoint = endpoints.apply(secrets);
        GatewayProperties.Timeouts t = props.timeouts();
        ConnectionProvider provider = ConnectionProvider.builder("bifrost-" + kind + "-" + connectorId)
                .maxConnections(secrets.getInt("max_pool_size", props.pool().maxSize()))
                .pendingAcquireTimeout(t.poolAcquire())
                .maxIdleTime(props.pool().idleTimeout())
                .build();
        HttpClient httpClient = HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) t.poolAcquire().toMillis())
                .responseTimeout(t.backendResponse());
        int maxInMemory = (int) Math.min(props.maxResponseBytes(), Integer.MAX_VALUE);
        WebClient web = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemory))
                .build();
        log.debug("HTTP {} client for connector {} targets {}", kind, connectorId, endpoint.baseUrl());
        return new Client(web, endpoint, provider);
    }

    public HttpPayload forward(HttpForward request, AuthorizationResult grant) {
        Client client = pools.acquire(grant.credentials());
        URI uri = client.endpoint().resolve(request.rawPath(), request.encodedQuery());
        Duration timeout = props.timeouts().backendResponse();

        WebClient.RequestBodySpec spec = client.web()
                .method(HttpMethod.valueOf(request.method()))
                .uri(uri)
                .headers(h -> {
                    h.addAll(request.headers());
                    client.endpoint().headers().forEach(h::set);
                });
        WebClient.RequestHeadersSpec<?> ready = request.body().length == 0 ? spec : spec.bodyValue(request.body());
        try {
            return ready.exchangeToMono(resp -> resp.bodyToMono(byte[].class)
                            .defaultIfEmpty(EMPTY)
                            .map(body -> new HttpPayload(resp.statusCode().value(),
                                    ForwardHeaders.response(resp.headers().asHttpHeaders()), body)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw translate(e, uri);
        }
    }

    private GatewayException translate(RuntimeException e, URI uri) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return new GatewayException(ErrorCode.BACKEND_TIMEOUT, kind + " backend timed out: " + uri.getHost(), e);
            }
            if (t instanceof DataBufferLimitException) {
                return new GatewayException(ErrorCode.RESPONSE_TOO_LARGE,
                        kind + " response exceeds " + props.maxResponseBytes() + " bytes", e);
            }
            if (t instanceof GatewayException ge) {
                return ge;
            }
        }
        if (e instanceof WebClientRequestException) {
            return new GatewayException(ErrorCode.BACKEND_UNREACHABLE,
                    kind + " backend unreachable: " + uri.getHost(), e);
        }
        return new GatewayException(ErrorCode.BACKEND_UNREACHABLE, kind + " request failed: " + e.getMessage(), e);
    }

    public void evict(String connectorId) {
        pools.evict(connectorId);
    }

    public int openPools() {
        return pools.size();
    }

    @Override
    public void close() {
        pools.close();
    }
}
