package org.iceforge.bifrost.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "bifrost.registry")
public record RegistryProperties(Duration cacheTtl) {
    public RegistryProperties {
        cacheTtl = cacheTtl == null ? Duration.ofSeconds(5) : cacheTtl;
    }
}
