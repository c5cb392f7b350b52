package org.iceforge.bifrost.gateway;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.gateway.config.IdentityProperties;
import org.iceforge.bifrost.gateway.config.RegistryProperties;
import org.iceforge.bifrost.gateway.config.VaultProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Document connectors build their own clients per connector.
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
@EnableConfigurationProperties({GatewayProperties.class, VaultProperties.class, IdentityProperties.class,
        RegistryProperties.class})
public class BifrostGatewayApplication {
  public static void main(String[] args) {
    SpringApplication.run(BifrostGatewayApplication.class, args);
  }
}
