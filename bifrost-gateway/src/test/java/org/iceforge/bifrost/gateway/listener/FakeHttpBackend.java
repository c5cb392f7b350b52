package org.iceforge.bifrost.gateway.listener;

import io.netty.handler.codec.http.HttpHeaders;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** A local HTTP server that records every request and answers with a fixed body. */
public final class FakeHttpBackend implements AutoCloseable {

    public record Received(String method, String uri, HttpHeaders headers, String body) {}

    private final List<Received> received = new CopyOnWriteArrayList<>();
    private final DisposableServer server;

    public FakeHttpBackend(int status, String contentType, String body) {
        this.server = HttpServer.create()
                .host("127.0.0.1")
                .port(0)
                .handle((req, res) -> req.receive().aggregate().asString().defaultIfEmpty("")
                        .flatMap(in -> {
                            received.add(new Received(req.method().name(), req.uri(), req.requestHeaders().copy(), in));
                            return res.status(status)
                                    .header("Content-Type", contentType)
                                    .sendString(Mono.just(body))
                                    .then();
                        }))
                .bindNow();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.port();
    }

    public List<Received> received() {
        return received;
    }

    public Received last() {
        return received.isEmpty() ? null : received.get(received.size() - 1);
    }

    @Override
    public void close() {
        server.disposeNow();
    }
}
