package org.iceforge.bifrost.model;

import java.util.Objects;

/** What a shared link points at: a connector or a dataset. */
public record LinkTarget(Kind kind, String id) {

    public enum Kind { CONNECTOR, DATASET }

    public LinkTarget {
        Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("link target id is required");
        }
    }

    public static LinkTarget connector(String connectorId) {
        return new LinkTarget(Kind.CONNECTOR, connectorId);
    }

    public static LinkTarget dataset(String datasetId) {
        return new LinkTarget(Kind.DATASET, datasetId);
    }

    public boolean isConnector() {
        return kind == Kind.CONNECTOR;
    }
}
