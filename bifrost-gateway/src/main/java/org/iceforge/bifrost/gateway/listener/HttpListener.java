package org.iceforge.bifrost.gateway.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.pipeline.ClientContext;
import org.iceforge.bifrost.pipeline.Protocol;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP listener on reactor-netty. Bodies are aggregated, then the blocking proxy pipeline
 * runs on the bounded-elastic scheduler so event-loop threads never wait on a backend.
 *
 * <p>{@code GET /health} is answered without authentication.
 */
public abstract class HttpListener implements ProtocolListener {
    private static final Logger log = LoggerFactory.getLogger(HttpListener.class);
    private static final byte[] EMPTY = new byte[0];

    private final Protocol protocol;
    private final GatewayProperties.Listener config;
    private final Duration idleTimeout;
    private final AtomicInteger inFlight = new AtomicInteger();
    protected final ObjectMapper json;

    private volatile DisposableServer server;

    protected HttpListener(Protocol protocol, GatewayProperties props, ObjectMapper json) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.config = props.listener(protocol);
        this.idleTimeout = props.timeouts().idle();
        this.json = Objects.requireNonNull(json, "json");
    }

    /** Handles one request. Runs on a worker thread and may block. */
    protected abstract HttpReply handle(HttpCall call);

    @Override
    public Protocol protocol() {
        return protocol;
    }

    @Override
    public synchronized void start() {
        if (server != null) return;
        server = HttpServer.create()
                .host(config.host())
                .port(config.port())
                .idleTimeout(idleTimeout)
                .route(routes -> routes.route(req -> true, this::dispatch))
                .bindNow();
        log.info("{} listener on {}:{}", protocol.id(), config.host(), server.port());
    }

    private Publisher<Void> dispatch(HttpServerRequest req, HttpServerResponse res) {
        QueryStringDecoder qs = new QueryStringDecoder(req.uri());
        String method = req.method().name();
        if ("GET".equals(method) && "/health".equals(qs.path())) {
            return send(res, health(), false);
        }

        ClientContext client = ClientContext.of(req.remoteAddress());
        inFlight.incrementAndGet();
        return req.receive().aggregate().asByteArray()
                .defaultIfEmpty(EMPTY)
                .map(body -> new HttpCall(method, qs.path(), qs.rawPath(), qs.parameters(),
                        req.requestHeaders(), body, client))
                .publishOn(Schedulers.boundedElastic())
                .map(this::handleSafely)
                .flatMap(reply -> Mono.from(send(res, reply, "HEAD".equals(method))))
                .doFinally(signal -> inFlight.decrementAndGet());
    }

    private HttpReply handleSafely(HttpCall call) {
        try {
            return handle(call);
        } catch (GatewayException e) {
            HttpReply reply = new HttpReply();
            HttpErrors.write(reply, e, json);
            return reply;
        } catch (RuntimeException e) {
            log.warn("{} request {} {} failed", protocol.id(), call.method(), call.path(), e);
            return new HttpReply().json(json, 500, Map.of("error", "internal error"));
        }
    }

    private static Publisher<Void> send(HttpServerResponse res, HttpReply reply, boolean headOnly) {
        res.status(reply.status());
        reply.headers().forEach(res::header);
        if (headOnly) {
            return res.send();
        }
        res.header(HttpHeaderNames.CONTENT_LENGTH, String.valueOf(reply.body().length));
        return res.sendByteArray(Mono.just(reply.body()));
    }

    private HttpReply health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("proxy_type", protocol.id());
        body.put("port", localPort());
        body.put("timestamp", Instant.now().toString());
        return new HttpReply().json(json, 200, body);
    }

    @Override
    public synchronized void stop(Duration grace) {
        DisposableServer s = server;
        if (s == null) return;
        server = null;
        try {
            s.disposeNow(grace);
        } catch (IllegalStateException e) {
            log.info("{} listener did not drain within {}: {}", protocol.id(), grace, e.getMessage());
        }
        log.info("{} listener stopped", protocol.id());
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    @Override
    public int localPort() {
        DisposableServer s = server;
        return s == null ? 0 : s.port();
    }

    @Override
    public int activeSessions() {
        return inFlight.get();
    }
}
