package org.iceforge.bifrost.gateway.http;

import org.springframework.http.HttpHeaders;

/** A client request after credential stripping, ready to send to an HTTP backend. */
public record HttpForward(String method, String rawPath, String encodedQuery, HttpHeaders headers, byte[] body) {

    public HttpForward {
        headers = headers == null ? new HttpHeaders() : headers;
        body = body == null ? new byte[0] : body;
    }
}
