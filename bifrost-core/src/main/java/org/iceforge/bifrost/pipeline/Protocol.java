package org.iceforge.bifrost.pipeline;

import org.iceforge.bifrost.model.ConnectorType;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** The seven listeners, their default ports and the connector types each one serves. */
public enum Protocol {
    MYSQL(10101, EnumSet.of(ConnectorType.RELATIONAL_A)),
    POSTGRESQL(10102, EnumSet.of(ConnectorType.RELATIONAL_B)),
    API(10103, EnumSet.of(ConnectorType.GENERIC_API)),
    CLICKHOUSE(10104, EnumSet.of(ConnectorType.COLUMNAR)),
    MONGODB(10105, EnumSet.of(ConnectorType.DOCUMENT)),
    S3(10106, EnumSet.of(ConnectorType.OBJECT_STORE)),
    SHARED(10107, EnumSet.allOf(ConnectorType.class));

    private final int defaultPort;
    private final Set<ConnectorType> connectorTypes;

    Protocol(int defaultPort, Set<ConnectorType> connectorTypes) {
        this.defaultPort = defaultPort;
        this.connectorTypes = Set.copyOf(connectorTypes);
    }

    public int defaultPort() {
        return defaultPort;
    }

    public Set<ConnectorType> connectorTypes() {
        return connectorTypes;
    }

    /** The dedicated listener for a connector type, never {@link #SHARED}. */
    public static Protocol serving(ConnectorType type) {
        for (Protocol p : values()) {
            if (p != SHARED && p.connectorTypes.contains(type)) {
                return p;
            }
        }
        throw new IllegalArgumentException("No listener serves " + type);
    }

    /** Lower-case name used in configuration keys, health payloads and audit lines. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
