package org.iceforge.bifrost.token;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Verifies identity tokens of the form {@code base64url(subject).expiryEpochSeconds.signature},
 * where the signature is HMAC-SHA256 over the first two parts with the shared secret.
 *
 * <p>Tokens are minted by the identity provider fronting the platform ({@link #issue} exists
 * for it and for tests). An unconfigured secret denies everything.
 */
public final class HmacIdentityVerifier implements IdentityVerifier {
    private static final String ALG = "HmacSHA256";

    private final byte[] secret;
    private final Duration allowedSkew;
    private final Clock clock;

    public HmacIdentityVerifier(String secret, Duration allowedSkew, Clock clock) {
        this.secret = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        this.allowedSkew = allowedSkew == null ? Duration.ofSeconds(30) : allowedSkew;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<CallerIdentity> verify(String identityToken) {
        if (secret.length == 0 || identityToken == null || identityToken.isBlank()) {
            return Optional.empty();
        }
        String[] parts = identityToken.trim().split("\\.");
        if (parts.length != 3) {
            return Optional.empty();
        }
        long expiry;
        String subject;
        try {
            expiry = Long.parseLong(parts[1]);
            subject = new String(Base64.getUrlDecoder().decode(parts[0]), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (subject.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (now.minus(allowedSkew).isAfter(Instant.ofEpochSecond(expiry))) {
            return Optional.empty();
        }
        String expected = sign(parts[0] + "." + parts[1]);
        if (!constantTimeEquals(expected, parts[2])) {
            return Optional.empty();
        }
        return Optional.of(new CallerIdentity(subject));
    }

    public String issue(String subject, Duration ttl) {
        String sub = Base64.getUrlEncoder().withoutPadding().encodeToString(subject.getBytes(StandardCharsets.UTF_8));
        String payload = sub + "." + clock.instant().plus(ttl).getEpochSecond();
        return payload + "." + sign(payload);
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance(ALG);
            mac.init(new SecretKeySpec(secret, ALG));
            byte[] out = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        byte[] x = a.getBytes(StandardCharsets.UTF_8);
        byte[] y = b.getBytes(StandardCharsets.UTF_8);
        if (x.length != y.length) return false;
        int r = 0;
        for (int i = 0; i < x.length; i++) r |= x[i] ^ y[i];
        return r == 0;
    }
}
