package org.iceforge.bifrost.model;

import java.util.Locale;
import java.util.Set;

/**
 * Kinds of backend a {@link ProxyConnector} can front.
 *
 * <p>Each type carries the operation names a connector gets when the owner registers it
 * without an explicit allow-list. Those defaults are read-only except for the generic API,
 * which keeps the long-standing {@code GET}/{@code POST} default.
 */
public enum ConnectorType {
    /** MySQL-compatible relational database. */
    RELATIONAL_A("relational-a", Set.of("SELECT", "SHOW", "DESCRIBE", "EXPLAIN")),
    /** PostgreSQL-compatible relational database. */
    RELATIONAL_B("relational-b", Set.of("SELECT", "SHOW", "EXPLAIN", "WITH", "VALUES")),
    /** ClickHouse-compatible columnar store. */
    COLUMNAR("columnar", Set.of("SELECT", "SHOW", "DESCRIBE", "EXPLAIN", "WITH")),
    /** MongoDB-compatible document store. */
    DOCUMENT("document", Set.of("FIND", "AGGREGATE", "COUNT", "DISTINCT", "LISTCOLLECTIONS")),
    /** S3-compatible object store. */
    OBJECT_STORE("object-store", Set.of("GET", "HEAD", "LIST")),
    /** Any HTTP API. */
    GENERIC_API("generic-api", Set.of("GET", "POST"));

    private final String wireName;
    private final Set<String> defaultOperations;

    ConnectorType(String wireName, Set<String> defaultOperations) {
        this.wireName = wireName;
        this.defaultOperations = defaultOperations;
    }

    public String wireName() {
        return wireName;
    }

    public Set<String> defaultOperations() {
        return defaultOperations;
    }

    /** Accepts the wire name ({@code object-store}) as well as the enum constant name. */
    public static ConnectorType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("connector type is required");
        }
        String v = value.trim();
        for (ConnectorType t : values()) {
            if (t.wireName.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown connector type '" + value + "'");
    }

    /** Normalizes an operation name the way connectors store them. */
    public static String normalizeOperation(String operation) {
        return operation == null ? "" : operation.trim().toUpperCase(Locale.ROOT);
    }
}
