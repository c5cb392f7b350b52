package org.iceforge.bifrost.vault;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VaultKeysTest {

    @TempDir
    Path dir;

    @Test
    void configuredKey_winsOverFile() {
        String b64 = Base64.getEncoder().encodeToString(new byte[32]);

        byte[] key = VaultKeys.load(b64, dir.resolve("ignored.key"), true);

        assertThat(key).hasSize(32);
        assertThat(Files.exists(dir.resolve("ignored.key"))).isFalse();
    }

    @Test
    void missingFile_isGenerated_whenAllowed_andReusedAfterwards() {
        Path file = dir.resolve("keys/vault.key");

        byte[] first = VaultKeys.load(null, file, true);
        byte[] second = VaultKeys.load(null, file, false);

        assertThat(first).hasSize(32);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void missingFile_fails_whenGenerationDisabled() {
        assertThatThrownBy(() -> VaultKeys.load("", dir.resolve("absent.key"), false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("absent.key");
    }

    @Test
    void garbageKey_isRejected() {
        assertThatThrownBy(() -> VaultKeys.load("not base64!!", null, false))
                .isInstanceOf(IllegalStateException.class);
    }
}
