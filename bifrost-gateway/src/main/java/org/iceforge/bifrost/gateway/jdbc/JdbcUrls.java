package org.iceforge.bifrost.gateway.jdbc;

import org.iceforge.bifrost.vault.ConnectorSecrets;

/**
 * Builds the JDBC URL of a relational connector from its secrets.
 *
 * <p>An explicit {@code jdbc_url} wins; otherwise {@code host}, {@code port} and
 * {@code database} are combined for the dialect. {@code ssl=true} turns on TLS.
 */
public final class JdbcUrls {
    private JdbcUrls() {}

    public static String forConnector(Dialect dialect, ConnectorSecrets secrets) {
        var explicit = secrets.get("jdbc_url");
        if (explicit.isPresent()) {
            return explicit.get();
        }
        String host = secrets.require("host");
        int port = secrets.getInt("port", dialect.defaultPort());
        String database = secrets.getOrDefault("database", "");
        boolean ssl = secrets.getBoolean("ssl", false);

        StringBuilder url = new StringBuilder(dialect.urlPrefix())
                .append(host).append(':').append(port).append('/').append(database);
        switch (dialect) {
            case MYSQL -> url.append(ssl ? "?sslMode=REQUIRED" : "?sslMode=DISABLED");
            case POSTGRESQL -> url.append(ssl ? "?sslmode=require" : "?sslmode=disable");
        }
        return url.toString();
    }
}
