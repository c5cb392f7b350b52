package org.iceforge.bifrost.gateway.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/** Response under construction; filled in by an adapter, sent by the listener. */
public final class HttpReply {
    private int status = 200;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private byte[] body = new byte[0];

    public int status() {
        return status;
    }

    public HttpReply status(int status) {
        this.status = status;
        return this;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public HttpReply header(String name, String value) {
        if (value != null) headers.put(name, value);
        return this;
    }

    public byte[] body() {
        return body;
    }

    public HttpReply body(byte[] body, String contentType) {
        this.body = body == null ? new byte[0] : body;
        header("Content-Type", contentType);
        return this;
    }

    public HttpReply text(int status, String text) {
        return status(status).body(text.getBytes(StandardCharsets.UTF_8), "text/plain; charset=UTF-8");
    }

    public HttpReply json(ObjectMapper mapper, int status, Object value) {
        try {
            return status(status).body(mapper.writeValueAsBytes(value), "application/json");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
