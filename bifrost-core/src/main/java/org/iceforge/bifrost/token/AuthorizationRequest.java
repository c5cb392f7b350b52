package org.iceforge.bifrost.token;

import org.iceforge.bifrost.model.ConnectorType;

import java.util.Objects;
import java.util.Set;

/**
 * One authorization question: may these credentials run {@code operation} through a listener
 * that serves {@code acceptedTypes}? Dataset links are only accepted where the listener says so,
 * and direct connector tokens only where the listener is not link-only.
 */
public record AuthorizationRequest(
        ClientCredentials credentials,
        String operation,
        Set<ConnectorType> acceptedTypes,
        boolean datasetLinksAccepted,
        boolean directTokensAccepted
) {
    public AuthorizationRequest {
        Objects.requireNonNull(credentials, "credentials");
        acceptedTypes = acceptedTypes == null ? Set.of() : Set.copyOf(acceptedTypes);
    }

    public AuthorizationRequest(ClientCredentials credentials, String operation,
                                Set<ConnectorType> acceptedTypes, boolean datasetLinksAccepted) {
        this(credentials, operation, acceptedTypes, datasetLinksAccepted, true);
    }
}
