package org.iceforge.bifrost.gateway.listener;

import io.netty.handler.codec.http.HttpHeaders;
import org.iceforge.bifrost.pipeline.ClientContext;

import java.util.List;
import java.util.Map;

/**
 * A fully received HTTP request, decoupled from the event loop. {@code path} is decoded,
 * {@code rawPath} is as the client sent it.
 */
public record HttpCall(
        String method,
        String path,
        String rawPath,
        Map<String, List<String>> query,
        HttpHeaders headers,
        byte[] body,
        ClientContext client
) {
    public HttpCall {
        query = query == null ? Map.of() : query;
        body = body == null ? new byte[0] : body;
    }

    public String param(String name) {
        List<String> values = query.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public String header(String name) {
        return headers == null ? null : headers.get(name);
    }

    /** Bearer credential from the Authorization header, or null. */
    public String bearer() {
        String auth = header("Authorization");
        if (auth == null || !auth.regionMatches(true, 0, "Bearer ", 0, 7)) return null;
        String token = auth.substring(7).trim();
        return token.isEmpty() ? null : token;
    }
}
