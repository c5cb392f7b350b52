package org.iceforge.bifrost.gateway.s3;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.http.HttpPayload;
import org.iceforge.bifrost.pipeline.backend.BackendPools;
import org.iceforge.bifrost.token.AuthorizationResult;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * Object-store calls against the connector's bucket, confined to its configured key prefix.
 *
 * <p>Errors S3 reports for the request (missing key, denied) come back as payloads carrying
 * the S3 status and error code. Transport failures are gateway errors.
 */
public class S3Backend implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(S3Backend.class);
    private static final int DEFAULT_MAX_KEYS = 1000;

    private final BackendPools<Bucket> pools;
    private final long maxResponseBytes;

    /** One connector's client, bucket and key prefix. */
    record Bucket(S3Client client, String name, String prefix) implements AutoCloseable {
        @Override
        public void close() {
            client.close();
        }

        String objectKey(String key) {
            return prefix + key;
        }

        String relative(String objectKey) {
            return objectKey.startsWith(prefix) ? objectKey.substring(prefix.length()) : objectKey;
        }
    }

    public S3Backend(S3ClientFactory clients, long maxResponseBytes) {
        Objects.requireNonNull(clients, "clients");
        this.maxResponseBytes = maxResponseBytes;
        this.pools = new BackendPools<>("s3", (id, secrets) -> open(clients, secrets));
    }

    private static Bucket open(S3ClientFactory clients, ConnectorSecrets secrets) {
        String prefix = secrets.getOrDefault("prefix", "");
        if (!prefix.isEmpty() && !prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        return new Bucket(clients.create(secrets), secrets.require("bucket"), prefix);
    }

    public HttpPayload execute(S3Request request, AuthorizationResult grant) {
        Bucket bucket = pools.acquire(grant.credentials());
        try {
            return switch (request.operation()) {
                case "GET" -> get(bucket, request.key());
                case "HEAD" -> head(bucket, request.key());
                case "PUT" -> put(bucket, request);
                case "DELETE" -> delete(bucket, request.key());
                case "LIST" -> list(bucket, request);
                default -> throw new GatewayException(ErrorCode.MALFORMED_REQUEST,
                        "unsupported object operation " + request.operation());
            };
        } catch (S3Exception e) {
            String code = e.awsErrorDetails() == null ? "InternalError" : e.awsErrorDetails().errorCode();
            log.debug("S3 {} {} on connector {} returned {} {}", request.operation(), request.key(),
                    grant.connectorId(), e.statusCode(), code);
            return error(e.statusCode(), code, code, request.key());
        } catch (ApiCallTimeoutException e) {
            throw new GatewayException(ErrorCode.BACKEND_TIMEOUT, "S3 call timed out", e);
        } catch (SdkClientException e) {
            throw new GatewayException(ErrorCode.BACKEND_UNREACHABLE, "S3 unreachable: " + e.getMessage(), e);
        }
    }

    private HttpPayload get(Bucket bucket, String key) {
        GetObjectRequest req = GetObjectRequest.builder().bucket(bucket.name()).key(bucket.objectKey(key)).build();
        try (ResponseInputStream<GetObjectResponse> in = bucket.client().getObject(req)) {
            GetObjectResponse meta = in.response();
            if (meta.contentLength() != null && meta.contentLength() > maxResponseBytes) {
                in.abort();
                throw tooLarge(key);
            }
            byte[] body = in.readNBytes((int) Math.min(maxResponseBytes + 1, Integer.MAX_VALUE));
            if (body.length > maxResponseBytes) {
                in.abort();
                throw tooLarge(key);
            }
            HttpHeaders h = new HttpHeaders();
            if (meta.contentType() != null) h.set(HttpHeaders.CONTENT_TYPE, meta.contentType());
            if (meta.eTag() != null) h.setETag(quoted(meta.eTag()));
            if (meta.lastModified() != null) h.setLastModified(meta.lastModified());
            return new HttpPayload(200, h, body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static HttpPayload head(Bucket bucket, String key) {
        HeadObjectResponse meta = bucket.client().headObject(
                HeadObjectRequest.builder().bucket(bucket.name()).key(bucket.objectKey(key)).build());
        HttpHeaders h = new HttpHeaders();
        if (meta.contentLength() != null) h.setContentLength(meta.contentLength());
        if (meta.contentType() != null) h.set(HttpHeaders.CONTENT_TYPE, meta.contentType());
        if (meta.eTag() != null) h.setETag(quoted(meta.eTag()));
        if (meta.lastModified() != null) h.setLastModified(meta.lastModified());
        return new HttpPayload(200, h, new byte[0]);
    }

    private static HttpPayload put(Bucket bucket, S3Request request) {
        if (request.key().isEmpty() || request.key().endsWith("/")) {
            return error(400, "InvalidRequest", "an object key is required", request.key());
        }
        PutObjectRequest.Builder req = PutObjectRequest.builder()
                .bucket(bucket.name())
                .key(bucket.objectKey(request.key()));
        String contentType = request.call().header(HttpHeaders.CONTENT_TYPE);
        if (contentType != null) req.contentType(contentType);
        PutObjectResponse resp = bucket.client().putObject(req.build(), RequestBody.fromBytes(request.call().body()));
        HttpHeaders h = new HttpHeaders();
        if (resp.eTag() != null) h.setETag(quoted(resp.eTag()));
        return new HttpPayload(200, h, new byte[0]);
    }

    private static HttpPayload delete(Bucket bucket, String key) {
        bucket.client().deleteObject(DeleteObjectRequest.builder().bucket(bucket.name()).key(bucket.objectKey(key)).build());
        return new HttpPayload(204, new HttpHeaders(), new byte[0]);
    }

    private static HttpPayload list(Bucket bucket, S3Request request) {
        String prefix = request.listPrefix();
        int maxKeys = parseMaxKeys(request.call().param("max-keys"));
        ListObjectsV2Request.Builder req = ListObjectsV2Request.builder()
                .bucket(bucket.name())
                .prefix(bucket.objectKey(prefix))
                .maxKeys(maxKeys);
        String delimiter = request.call().param("delimiter");
        if (delimiter != null) req.delimiter(delimiter);
        String token = request.call().param("continuation-token");
        if (token != null) req.continuationToken(token);

        ListObjectsV2Response resp = bucket.client().listObjectsV2(req.build());
        List<S3Xml.Entry> entries = resp.contents().stream()
                .map((S3Object o) -> new S3Xml.Entry(bucket.relative(o.key()), o.size() == null ? 0 : o.size(),
                        o.lastModified(), o.eTag()))
                .toList();
        List<String> prefixes = resp.commonPrefixes().stream()
                .map(CommonPrefix::prefix)
                .map(bucket::relative)
                .toList();
        boolean truncated = Boolean.TRUE.equals(resp.isTruncated());
        byte[] xml = S3Xml.listBucket(prefix, entries, prefixes, truncated, resp.nextContinuationToken(), maxKeys);
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.CONTENT_TYPE, S3Xml.CONTENT_TYPE);
        return new HttpPayload(200, h, xml);
    }

    static HttpPayload error(int status, String code, String message, String resource) {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.CONTENT_TYPE, S3Xml.CONTENT_TYPE);
        return new HttpPayload(status, h, S3Xml.error(code, message, resource));
    }

    private GatewayException tooLarge(String key) {
        return new GatewayException(ErrorCode.RESPONSE_TOO_LARGE,
                "object " + key + " exceeds " + maxResponseBytes + " bytes");
    }

    private static int parseMaxKeys(String value) {
        if (value == null) return DEFAULT_MAX_KEYS;
        try {
            int n = Integer.parseInt(value.trim());
            return n <= 0 ? DEFAULT_MAX_KEYS : Math.min(n, DEFAULT_MAX_KEYS);
        } catch (NumberFormatException e) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "max-keys is not a number");
        }
    }

    private static String quoted(String etag) {
        return etag.startsWith("\"") ? etag : "\"" + etag + "\"";
    }

    public void evict(String connectorId) {
        pools.evict(connectorId);
    }

    @Override
    public void close() {
        pools.close();
    }
}
