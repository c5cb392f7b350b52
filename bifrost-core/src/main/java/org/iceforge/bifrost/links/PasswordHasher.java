package org.iceforge.bifrost.links;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/** PBKDF2-HMAC-SHA256 hashes in the form {@code salt$iterations$hash} (both base64). */
public final class PasswordHasher {
    private static final String ALG = "PBKDF2WithHmacSHA256";
    private static final int SALT_BYTES = 16;
    private static final int KEY_BITS = 256;
    public static final int DEFAULT_ITERATIONS = 100_000;

    private final int iterations;
    private final SecureRandom random = new SecureRandom();

    public PasswordHasher() {
        this(DEFAULT_ITERATIONS);
    }

    public PasswordHasher(int iterations) {
        if (iterations < 1) throw new IllegalArgumentException("iterations must be positive");
        this.iterations = iterations;
    }

    public String hash(String password) {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        byte[] dk = derive(password.toCharArray(), salt, iterations);
        Base64.Encoder enc = Base64.getEncoder();
        return enc.encodeToString(salt) + "$" + iterations + "$" + enc.encodeToString(dk);
    }

    /** Constant-time check. A malformed stored hash never matches. */
    public boolean matches(String password, String stored) {
        if (password == null || stored == null) return false;
        String[] parts = stored.split("\\$");
        if (parts.length != 3) return false;
        try {
            Base64.Decoder dec = Base64.getDecoder();
            byte[] salt = dec.decode(parts[0]);
            int iter = Integer.parseInt(parts[1]);
            byte[] expected = dec.decode(parts[2]);
            return MessageDigest.isEqual(expected, derive(password.toCharArray(), salt, iter));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static byte[] derive(char[] password, byte[] salt, int iterations) {
        PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, KEY_BITS);
        try {
            return SecretKeyFactory.getInstance(ALG).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }
}
