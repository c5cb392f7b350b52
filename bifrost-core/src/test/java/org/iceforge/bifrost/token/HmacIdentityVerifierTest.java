package org.iceforge.bifrost.token;

import org.iceforge.bifrost.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HmacIdentityVerifierTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final HmacIdentityVerifier verifier = new HmacIdentityVerifier("s3cr3t", Duration.ofSeconds(30), clock);

    @Test
    void issuedToken_verifiesToItsSubject() {
        String token = verifier.issue("carol@example.com", Duration.ofMinutes(1));

        assertThat(verifier.verify(token)).contains(new CallerIdentity("carol@example.com"));
    }

    @Test
    void expiredToken_isRejected_afterSkew() {
        String token = verifier.issue("carol", Duration.ofMinutes(1));

        clock.advance(Duration.ofSeconds(80));
        assertThat(verifier.verify(token)).isPresent();
        clock.advance(Duration.ofSeconds(20));
        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    void tokenSignedWithOtherSecret_isRejected() {
        String foreign = new HmacIdentityVerifier("other", Duration.ZERO, clock).issue("carol", Duration.ofMinutes(1));

        assertThat(verifier.verify(foreign)).isEmpty();
    }

    @Test
    void garbage_isRejected() {
        assertThat(verifier.verify(null)).isEmpty();
        assertThat(verifier.verify("a.b")).isEmpty();
        assertThat(verifier.verify("!!.notanumber.sig")).isEmpty();
    }

    @Test
    void unconfiguredSecret_deniesEverything() {
        HmacIdentityVerifier open = new HmacIdentityVerifier("", Duration.ZERO, clock);

        assertThat(open.verify(verifier.issue("carol", Duration.ofMinutes(1)))).isEmpty();
    }
}
