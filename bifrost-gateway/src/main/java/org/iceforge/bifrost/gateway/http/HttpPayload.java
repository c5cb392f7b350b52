package org.iceforge.bifrost.gateway.http;

import org.springframework.http.HttpHeaders;

/** A buffered backend response. Non-2xx statuses are results too. */
public record HttpPayload(int status, HttpHeaders headers, byte[] body) {

    public HttpPayload {
        headers = headers == null ? new HttpHeaders() : headers;
        body = body == null ? new byte[0] : body;
    }
}
