package org.iceforge.bifrost.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the credential vault key comes from.
 *
 * <p>{@code key} is base64; otherwise {@code keyFile} is read, and only created when
 * {@code generateIfMissing} is set.
 */
@ConfigurationProperties(prefix = "bifrost.vault")
public record VaultProperties(String key, String keyFile, boolean generateIfMissing) {
}
