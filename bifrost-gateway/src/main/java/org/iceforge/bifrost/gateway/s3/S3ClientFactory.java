package org.iceforge.bifrost.gateway.s3;

import org.iceforge.bifrost.vault.ConnectorSecrets;
import software.amazon.awssdk.services.s3.S3Client;

/** Builds the S3 client of one object-store connector from its opened secrets. */
@FunctionalInterface
public interface S3ClientFactory {

    S3Client create(ConnectorSecrets secrets);
}
