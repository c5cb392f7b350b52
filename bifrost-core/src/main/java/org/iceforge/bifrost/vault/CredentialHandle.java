package org.iceforge.bifrost.vault;

import org.iceforge.bifrost.model.EncryptedBlob;

import java.util.Objects;
import java.util.function.Function;

/**
 * Request-scoped capability to use one connector's secrets.
 *
 * <p>Holds the sealed blob, never the plaintext. Each {@link #withSecrets} call opens it,
 * hands it to the function and drops it. Closed handles refuse further use.
 */
public final class CredentialHandle implements AutoCloseable {
    private final String connectorId;
    private final EncryptedBlob blob;
    private final CredentialVault vault;
    private volatile boolean closed;

    CredentialHandle(String connectorId, EncryptedBlob blob, CredentialVault vault) {
        this.connectorId = Objects.requireNonNull(connectorId, "connectorId");
        this.blob = Objects.requireNonNull(blob, "blob");
        this.vault = Objects.requireNonNull(vault, "vault");
    }

    public String connectorId() {
        return connectorId;
    }

    public <T> T withSecrets(Function<ConnectorSecrets, T> use) {
        if (closed) {
            throw new IllegalStateException("credential handle for " + connectorId + " is closed");
        }
        return use.apply(vault.decrypt(connectorId, blob));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return "CredentialHandle[" + connectorId + (closed ? ", closed" : "") + "]";
    }
}
