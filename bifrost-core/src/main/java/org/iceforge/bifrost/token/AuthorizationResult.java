package org.iceforge.bifrost.token;

import org.iceforge.bifrost.audit.AccessEvent;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.vault.CredentialHandle;

/**
 * A granted request. {@code connector} and {@code credentials} are null for dataset links;
 * {@code link} is null for direct connector tokens. Closing the result closes the handle.
 */
public record AuthorizationResult(
        ProxyConnector connector,
        SharedLink link,
        String datasetId,
        CallerIdentity caller,
        String operation,
        CredentialHandle credentials
) implements AutoCloseable {

    public String connectorId() {
        return connector == null ? null : connector.id();
    }

    public String shareId() {
        return link == null ? null : link.shareId();
    }

    public boolean isDataset() {
        return datasetId != null;
    }

    public String callerName() {
        return caller == null ? AccessEvent.ANONYMOUS : caller.subject();
    }

    @Override
    public void close() {
        if (credentials != null) credentials.close();
    }
}
