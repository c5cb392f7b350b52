package org.iceforge.bifrost.gateway.jdbc;

/** Relational backend flavours reachable over JDBC. */
public enum Dialect {
    MYSQL("jdbc:mysql://", 3306),
    POSTGRESQL("jdbc:postgresql://", 5432);

    private final String urlPrefix;
    private final int defaultPort;

    Dialect(String urlPrefix, int defaultPort) {
        this.urlPrefix = urlPrefix;
        this.defaultPort = defaultPort;
    }

    public String urlPrefix() {
        return urlPrefix;
    }

    public int defaultPort() {
        return defaultPort;
    }
}
