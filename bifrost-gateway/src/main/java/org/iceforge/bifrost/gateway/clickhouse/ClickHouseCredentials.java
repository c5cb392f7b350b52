package org.iceforge.bifrost.gateway.clickhouse;

import org.iceforge.bifrost.gateway.http.HttpEndpoint;
import org.iceforge.bifrost.vault.ConnectorSecrets;

import java.util.HashMap;
import java.util.Map;

/** The ClickHouse HTTP interface of a columnar connector, with its real user in headers. */
public final class ClickHouseCredentials {
    static final int DEFAULT_HTTP_PORT = 8123;
    static final int DEFAULT_HTTPS_PORT = 8443;

    private ClickHouseCredentials() {
    }

    public static HttpEndpoint endpoint(ConnectorSecrets secrets) {
        String base = secrets.get("base_url").orElseGet(() -> {
            boolean ssl = secrets.getBoolean("ssl", false);
            int port = secrets.getInt("port", ssl ? DEFAULT_HTTPS_PORT : DEFAULT_HTTP_PORT);
            return (ssl ? "https://" : "http://") + secrets.require("host") + ":" + port;
        });
        Map<String, String> headers = new HashMap<>();
        headers.put("X-ClickHouse-User", secrets.getOrDefault("username", "default"));
        secrets.get("password").ifPresent(p -> headers.put("X-ClickHouse-Key", p));
        secrets.get("database").ifPresent(db -> headers.put("X-ClickHouse-Database", db));
        return new HttpEndpoint(base, headers);
    }
}
