package org.iceforge.bifrost.gateway.share;

import org.iceforge.bifrost.model.ConnectorType;

import java.util.EnumSet;
import java.util.Set;

/** What a request under {@code /share/{shareId}} asks for, and which link targets can answer it. */
enum ShareRoute {
    /** {@code GET /share/{id}}: the link's public descriptor and connection hints. */
    INFO("", EnumSet.allOf(ConnectorType.class), true),
    /** {@code GET /share/{id}/data}: the dataset a dataset link points at. */
    DATA("data", EnumSet.noneOf(ConnectorType.class), true),
    API("api", EnumSet.of(ConnectorType.GENERIC_API), false),
    OBJECTS("objects", EnumSet.of(ConnectorType.OBJECT_STORE), false),
    QUERY("query", EnumSet.of(ConnectorType.RELATIONAL_A, ConnectorType.RELATIONAL_B, ConnectorType.COLUMNAR), false),
    COMMAND("command", EnumSet.of(ConnectorType.DOCUMENT), false);

    private final String segment;
    private final Set<ConnectorType> connectorTypes;
    private final boolean datasetLinks;

    ShareRoute(String segment, Set<ConnectorType> connectorTypes, boolean datasetLinks) {
        this.segment = segment;
        this.connectorTypes = Set.copyOf(connectorTypes);
        this.datasetLinks = datasetLinks;
    }

    String segment() {
        return segment;
    }

    Set<ConnectorType> connectorTypes() {
        return connectorTypes;
    }

    boolean acceptsDatasetLinks() {
        return datasetLinks;
    }

    static ShareRoute fromSegment(String segment) {
        for (ShareRoute r : values()) {
            if (r.segment.equals(segment)) return r;
        }
        return null;
    }
}
