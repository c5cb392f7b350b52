package org.iceforge.bifrost.gateway.s3;

import org.iceforge.bifrost.gateway.listener.HttpCall;

/**
 * An object-store call: {@code /{token}/{key}}.
 *
 * @param operation GET, HEAD, PUT, DELETE or LIST
 * @param key       object key relative to the connector's prefix; for LIST, the listing prefix
 */
public record S3Request(HttpCall call, String token, String key, String operation) {

    public static S3Request parse(HttpCall call) {
        String path = call.path().startsWith("/") ? call.path().substring(1) : call.path();
        int slash = path.indexOf('/');
        String token = slash < 0 ? path : path.substring(0, slash);
        String key = slash < 0 ? "" : path.substring(slash + 1);
        return of(call, token, key);
    }

    /** A call whose token was taken from somewhere other than the path, such as a shared link. */
    public static S3Request of(HttpCall call, String token, String key) {
        String k = key == null ? "" : key;
        return new S3Request(call, token == null || token.isEmpty() ? null : token, k, operation(call, k));
    }

    private static String operation(HttpCall call, String key) {
        String method = call.method();
        if ("GET".equals(method) && (key.isEmpty() || key.endsWith("/") || call.param("list-type") != null)) {
            return "LIST";
        }
        return method;
    }

    /** LIST prefix: the {@code prefix} parameter, else the key path. */
    String listPrefix() {
        String p = call.param("prefix");
        return p != null ? p : key;
    }
}
