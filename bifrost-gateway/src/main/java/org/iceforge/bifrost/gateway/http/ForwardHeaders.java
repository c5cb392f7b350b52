package org.iceforge.bifrost.gateway.http;

import io.netty.handler.codec.http.QueryStringEncoder;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Header and query filtering between client and backend. Hop-by-hop headers never cross,
 * and neither does anything that carried a gateway credential.
 */
public final class ForwardHeaders {

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "te", "trailer",
            "transfer-encoding", "upgrade", "host", "content-length");

    /** Client headers that may carry a token, link password or identity. */
    public static final Set<String> CREDENTIAL_HEADERS = Set.of(
            "authorization", "x-share-password", "x-identity-token", "x-clickhouse-user", "x-clickhouse-key",
            "cookie");

    /** Query parameters that may carry a token, link password or identity. */
    public static final Set<String> CREDENTIAL_PARAMS = Set.of("token", "password", "identity");

    private ForwardHeaders() {
    }

    public static HttpHeaders request(io.netty.handler.codec.http.HttpHeaders in) {
        HttpHeaders out = new HttpHeaders();
        if (in == null) return out;
        for (Map.Entry<String, String> e : in.entries()) {
            String name = e.getKey().toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP.contains(name) && !CREDENTIAL_HEADERS.contains(name)) {
                out.add(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    public static HttpHeaders response(HttpHeaders in) {
        HttpHeaders out = new HttpHeaders();
        in.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP.contains(lower) && !lower.equals("set-cookie")) {
                out.addAll(name, values);
            }
        });
        return out;
    }

    /** Re-encodes the decoded query without the credential parameters. */
    public static String query(Map<String, List<String>> params, Set<String> stripped) {
        QueryStringEncoder enc = new QueryStringEncoder("", StandardCharsets.UTF_8);
        params.forEach((name, values) -> {
            if (stripped.contains(name.toLowerCase(Locale.ROOT))) return;
            for (String v : values) {
                enc.addParam(name, v);
            }
        });
        String s = enc.toString();
        return s.startsWith("?") ? s.substring(1) : s;
    }
}
