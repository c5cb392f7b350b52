package org.iceforge.bifrost.registry;

import org.iceforge.bifrost.vault.ConnectorSecrets;

import java.util.Set;

/** Partial update; null fields keep their current value. New secrets are re-sealed. */
public record ConnectorUpdate(
        String name,
        String description,
        ConnectorSecrets secrets,
        Set<String> allowedOperations,
        Boolean visibleToOthers
) {}
