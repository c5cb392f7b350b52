package org.iceforge.bifrost.registry;

import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.vault.ConnectorSecrets;

import java.util.Set;

/**
 * Registration request. An empty {@code allowedOperations} means the type's read-only defaults.
 */
public record NewConnector(
        String ownerId,
        String name,
        String description,
        ConnectorType type,
        ConnectorSecrets secrets,
        Set<String> allowedOperations,
        boolean visibleToOthers
) {}
