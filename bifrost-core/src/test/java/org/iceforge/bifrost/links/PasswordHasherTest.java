package org.iceforge.bifrost.links;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(1_000);

    @Test
    void matches_onlyTheOriginalPassword() {
        String stored = hasher.hash("correct horse");

        assertThat(hasher.matches("correct horse", stored)).isTrue();
        assertThat(hasher.matches("correct horsE", stored)).isFalse();
        assertThat(hasher.matches("", stored)).isFalse();
    }

    @Test
    void samePassword_hashesDifferently() {
        assertThat(hasher.hash("pw")).isNotEqualTo(hasher.hash("pw"));
    }

    @Test
    void storedFormat_carriesIterations() {
        assertThat(hasher.hash("pw").split("\\$")).hasSize(3).contains("1000");
    }

    @Test
    void malformedStoredHash_neverMatches() {
        assertThat(hasher.matches("pw", "garbage")).isFalse();
        assertThat(hasher.matches("pw", "a$b$c")).isFalse();
        assertThat(hasher.matches("pw", null)).isFalse();
    }
}
