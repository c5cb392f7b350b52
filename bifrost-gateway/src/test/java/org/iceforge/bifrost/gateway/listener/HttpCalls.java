package org.iceforge.bifrost.gateway.listener;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.iceforge.bifrost.pipeline.ClientContext;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/** Builds {@link HttpCall}s for listener-level unit tests. */
public final class HttpCalls {
    private HttpCalls() {}

    public static HttpCall of(String method, String uri) {
        return of(method, uri, "", new DefaultHttpHeaders());
    }

    public static HttpCall of(String method, String uri, String body) {
        return of(method, uri, body, new DefaultHttpHeaders());
    }

    public static HttpCall of(String method, String uri, String body, HttpHeaders headers) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        return new HttpCall(method, decoder.path(), decoder.rawPath(), decoder.parameters(), headers,
                body.getBytes(StandardCharsets.UTF_8),
                ClientContext.of(new InetSocketAddress("127.0.0.1", 40000)));
    }
}
