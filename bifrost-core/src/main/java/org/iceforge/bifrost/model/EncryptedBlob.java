package org.iceforge.bifrost.model;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Opaque ciphertext plus the nonce it was sealed with.
 *
 * <p>Stored as two base64 columns; never decoded outside the vault.
 */
public final class EncryptedBlob {
    private final byte[] ciphertext;
    private final byte[] nonce;

    public EncryptedBlob(byte[] ciphertext, byte[] nonce) {
        this.ciphertext = Objects.requireNonNull(ciphertext, "ciphertext").clone();
        this.nonce = Objects.requireNonNull(nonce, "nonce").clone();
    }

    public static EncryptedBlob fromBase64(String ciphertext, String nonce) {
        Base64.Decoder d = Base64.getDecoder();
        return new EncryptedBlob(d.decode(ciphertext), d.decode(nonce));
    }

    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public byte[] nonce() {
        return nonce.clone();
    }

    public String ciphertextBase64() {
        return Base64.getEncoder().encodeToString(ciphertext);
    }

    public String nonceBase64() {
        return Base64.getEncoder().encodeToString(nonce);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedBlob other)) return false;
        return Arrays.equals(ciphertext, other.ciphertext) && Arrays.equals(nonce, other.nonce);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(ciphertext) + Arrays.hashCode(nonce);
    }

    @Override
    public String toString() {
        return "EncryptedBlob[" + ciphertext.length + " bytes]";
    }
}
