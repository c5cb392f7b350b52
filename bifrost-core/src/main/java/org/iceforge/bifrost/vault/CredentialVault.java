package org.iceforge.bifrost.vault;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.audit.AlertSink;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.model.EncryptedBlob;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Map;
import java.util.Objects;

/**
 * Seals connector secrets with AES/GCM and opens them on demand.
 *
 * <p>The connector id is bound in as associated data, so a blob copied onto another
 * connector row fails to open. Every failure to open is reported as
 * {@link ErrorCode#CONNECTOR_UNAVAILABLE} and raised as an alert; there is no fallback value.
 */
public final class CredentialVault {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final SecretKey key;
    private final AlertSink alerts;
    private final ObjectMapper mapper = new ObjectMapper();
    private final SecureRandom random = new SecureRandom();

    public CredentialVault(byte[] rawKey, AlertSink alerts) {
        Objects.requireNonNull(rawKey, "rawKey");
        if (rawKey.length != 16 && rawKey.length != 24 && rawKey.length != 32) {
            throw new IllegalArgumentException("vault key must be 128, 192 or 256 bits, got " + rawKey.length * 8);
        }
        this.key = new SecretKeySpec(rawKey.clone(), "AES");
        this.alerts = Objects.requireNonNull(alerts, "alerts");
    }

    public EncryptedBlob encrypt(String connectorId, ConnectorSecrets secrets) {
        Objects.requireNonNull(connectorId, "connectorId");
        Objects.requireNonNull(secrets, "secrets");
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            byte[] plain = mapper.writeValueAsBytes(secrets.asMap());
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            cipher.updateAAD(connectorId.getBytes(StandardCharsets.UTF_8));
            return new EncryptedBlob(cipher.doFinal(plain), nonce);
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("failed to seal connector secrets", e);
        }
    }

    /**
     * Opens a blob. Prefer {@link #open} so the plaintext never outlives its use.
     *
     * @throws GatewayException with {@link ErrorCode#CONNECTOR_UNAVAILABLE} on any failure
     */
    public ConnectorSecrets decrypt(String connectorId, EncryptedBlob blob) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, blob.nonce()));
            cipher.updateAAD(connectorId.getBytes(StandardCharsets.UTF_8));
            byte[] plain = cipher.doFinal(blob.ciphertext());
            return ConnectorSecrets.of(mapper.readValue(plain, MAP_TYPE));
        } catch (GeneralSecurityException | IOException | RuntimeException e) {
            alerts.raise("vault", connectorId, "connector secrets could not be decrypted", e);
            throw new GatewayException(ErrorCode.CONNECTOR_UNAVAILABLE,
                    "credentials of connector " + connectorId + " could not be decrypted", e);
        }
    }

    public CredentialHandle open(String connectorId, EncryptedBlob blob) {
        return new CredentialHandle(connectorId, blob, this);
    }
}
