package org.iceforge.bifrost.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Shared secret for caller identity tokens. An empty secret rejects every identity token. */
@ConfigurationProperties(prefix = "bifrost.identity")
public record IdentityProperties(String secret, Duration allowedSkew) {
    public IdentityProperties {
        secret = secret == null ? "" : secret;
        allowedSkew = allowedSkew == null ? Duration.ofSeconds(30) : allowedSkew;
    }
}
