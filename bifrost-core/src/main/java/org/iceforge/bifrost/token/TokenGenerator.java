package org.iceforge.bifrost.token;

import java.security.SecureRandom;
import java.util.Base64;

/** URL-safe random identifiers and bearer tokens. */
public final class TokenGenerator {
    static final int CONNECTOR_ID_BYTES = 16;
    static final int ACCESS_TOKEN_BYTES = 32;
    static final int SHARE_ID_BYTES = 24;

    private final SecureRandom random;

    public TokenGenerator() {
        this(new SecureRandom());
    }

    public TokenGenerator(SecureRandom random) {
        this.random = random;
    }

    public String connectorId() {
        return urlSafe(CONNECTOR_ID_BYTES);
    }

    public String accessToken() {
        return urlSafe(ACCESS_TOKEN_BYTES);
    }

    public String shareId() {
        return urlSafe(SHARE_ID_BYTES);
    }

    public String urlSafe(int bytes) {
        byte[] b = new byte[bytes];
        random.nextBytes(b);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(b);
    }
}
