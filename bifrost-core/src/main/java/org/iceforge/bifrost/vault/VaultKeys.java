package org.iceforge.bifrost.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;

/** Loads the vault key from configuration or a key file, generating one only when allowed. */
public final class VaultKeys {
    private static final Logger log = LoggerFactory.getLogger(VaultKeys.class);
    private static final int GENERATED_KEY_BYTES = 32;

    private VaultKeys() {}

    public static byte[] load(String base64Key, Path keyFile, boolean generateIfMissing) {
        if (base64Key != null && !base64Key.isBlank()) {
            return decode(base64Key, "bifrost.vault.key");
        }
        if (keyFile == null) {
            throw new IllegalStateException("No vault key configured: set bifrost.vault.key or bifrost.vault.key-file");
        }
        try {
            if (Files.exists(keyFile)) {
                return decode(Files.readString(keyFile, StandardCharsets.US_ASCII), keyFile.toString());
            }
            if (!generateIfMissing) {
                throw new IllegalStateException("Vault key file " + keyFile + " does not exist");
            }
            byte[] key = new byte[GENERATED_KEY_BYTES];
            new SecureRandom().nextBytes(key);
            Path parent = keyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(keyFile, Base64.getEncoder().encodeToString(key), StandardCharsets.US_ASCII);
            log.warn("Generated a new vault key at {}; connectors sealed with any previous key are unreadable", keyFile);
            return key;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load vault key from " + keyFile, e);
        }
    }

    private static byte[] decode(String value, String source) {
        try {
            return Base64.getDecoder().decode(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Vault key from " + source + " is not valid base64", e);
        }
    }
}
