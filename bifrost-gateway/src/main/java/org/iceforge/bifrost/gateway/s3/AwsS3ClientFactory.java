package org.iceforge.bifrost.gateway.s3;

import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;

/**
 * AWS SDK client per connector. Static keys from the connector win; without them the SDK's
 * default credential chain is used.
 */
public final class AwsS3ClientFactory implements S3ClientFactory {
    private static final Logger log = LoggerFactory.getLogger(AwsS3ClientFactory.class);

    private final Duration apiCallTimeout;

    public AwsS3ClientFactory(Duration apiCallTimeout) {
        this.apiCallTimeout = apiCallTimeout;
    }

    @Override
    public S3Client create(ConnectorSecrets secrets) {
        String region = secrets.getOrDefault("region", "us-east-1");
        String endpoint = secrets.get("endpoint").orElse(null);

        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(credentials(secrets))
                .region(Region.of(region))
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(secrets.getBoolean("path_style", endpoint != null))
                                .build()
                )
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout)
                        .build());

        if (endpoint != null) {
            b = b.endpointOverride(URI.create(endpoint));
        }

        log.info("Building S3 client region={}, endpointOverride={}", region, endpoint == null ? "<none>" : endpoint);
        return b.build();
    }

    private static AwsCredentialsProvider credentials(ConnectorSecrets secrets) {
        if (secrets.get("access_key_id").isPresent()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(
                    secrets.require("access_key_id"), secrets.require("secret_access_key")));
        }
        return DefaultCredentialsProvider.create();
    }
}
