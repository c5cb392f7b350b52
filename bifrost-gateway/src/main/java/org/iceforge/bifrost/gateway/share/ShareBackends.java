package org.iceforge.bifrost.gateway.share;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.http.ApiAdapter;
import org.iceforge.bifrost.gateway.http.HttpBackend;
import org.iceforge.bifrost.gateway.http.HttpForward;
import org.iceforge.bifrost.gateway.http.HttpPayload;
import org.iceforge.bifrost.gateway.jdbc.JdbcBackend;
import org.iceforge.bifrost.gateway.jdbc.JdbcResult;
import org.iceforge.bifrost.gateway.mongo.MongoBackend;
import org.iceforge.bifrost.gateway.mongo.MongoRequest;
import org.iceforge.bifrost.gateway.mongo.MongoSessions;
import org.iceforge.bifrost.gateway.s3.S3Backend;
import org.iceforge.bifrost.gateway.s3.S3Request;
import org.iceforge.bifrost.token.AuthorizationResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs an authorized shared-link request on the backend family its connector belongs to.
 * Every answer is an HTTP payload; relational and document results are rendered as JSON.
 */
final class ShareBackends {

    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private final JdbcBackend mysql;
    private final JdbcBackend postgres;
    private final HttpBackend api;
    private final HttpBackend clickhouse;
    private final S3Backend objects;
    private final MongoBackend documents;
    private final DatasetCatalog datasets;
    private final LinkDescriptors descriptors;
    private final ObjectMapper json;
    private final long maxResponseBytes;

    ShareBackends(JdbcBackend mysql, JdbcBackend postgres, HttpBackend api, HttpBackend clickhouse, S3Backend objects,
                  MongoBackend documents, DatasetCatalog datasets, LinkDescriptors descriptors, ObjectMapper json,
                  long maxResponseBytes) {
        this.mysql = Objects.requireNonNull(mysql, "mysql");
        this.postgres = Objects.requireNonNull(postgres, "postgres");
        this.api = Objects.requireNonNull(api, "api");
        this.clickhouse = Objects.requireNonNull(clickhouse, "clickhouse");
        this.objects = Objects.requireNonNull(objects, "objects");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.datasets = Objects.requireNonNull(datasets, "datasets");
        this.descriptors = Objects.requireNonNull(descriptors, "descriptors");
        this.json = Objects.requireNonNull(json, "json");
        this.maxResponseBytes = maxResponseBytes;
    }

    HttpPayload invoke(ShareRequest request, AuthorizationResult grant) {
        return switch (request.route()) {
            case INFO -> QueryResults.payload(200, descriptors.describe(grant), json, maxResponseBytes);
            case DATA -> dataset(grant);
            case API -> api.forward(ApiAdapter.forward(request.call(), request.rawRest()), grant);
            case OBJECTS -> objects.execute(S3Request.of(request.call(), request.shareId(), request.rest()), grant);
            case QUERY -> query(request, grant);
            case COMMAND -> command(request, grant);
        };
    }

    private HttpPayload dataset(AuthorizationResult grant) {
        DatasetCatalog.Dataset d = datasets.find(grant.datasetId())
                .orElseThrow(() -> new GatewayException(ErrorCode.LINK_NOT_FOUND,
                        "dataset " + grant.datasetId() + " is not in the catalog"));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("share_id", grant.shareId());
        body.put("dataset_id", d.id());
        body.put("name", d.name());
        body.put("description", d.description());
        body.put("format", d.format());
        body.put("url", d.url());
        return QueryResults.payload(200, body, json, maxResponseBytes);
    }

    private HttpPayload query(ShareRequest request, AuthorizationResult grant) {
        return switch (grant.connector().type()) {
            case RELATIONAL_A -> jdbc(mysql, request.statement(), grant);
            case RELATIONAL_B -> jdbc(postgres, request.statement(), grant);
            case COLUMNAR -> {
                HttpHeaders h = new HttpHeaders();
                h.setContentType(MediaType.TEXT_PLAIN);
                yield clickhouse.forward(new HttpForward("POST", "/", "default_format=JSON", h,
                        request.statement().getBytes(StandardCharsets.UTF_8)), grant);
            }
            default -> throw new GatewayException(ErrorCode.OPERATION_NOT_ALLOWED,
                    "connector type " + grant.connector().type().wireName() + " does not take queries");
        };
    }

    private HttpPayload jdbc(JdbcBackend backend, String sql, AuthorizationResult grant) {
        try (JdbcResult result = backend.execute(sql, grant)) {
            return QueryResults.toJson(result, json, maxResponseBytes);
        }
    }

    private HttpPayload command(ShareRequest request, AuthorizationResult grant) {
        BsonDocument command = request.command();
        String database = request.database(command);
        BsonDocument stripped = new BsonDocument();
        command.forEach((k, v) -> {
            if (!k.startsWith("$")) stripped.append(k, v);
        });
        try (MongoSessions sessions = new MongoSessions()) {
            BsonDocument reply = documents.run(new MongoRequest(null, database, stripped, grant.operation(), sessions),
                    grant);
            BsonValue ok = reply.get("ok");
            int status = ok != null && ok.isNumber() && ok.asNumber().doubleValue() == 1.0 ? 200 : 400;
            byte[] body = reply.toJson(RELAXED).getBytes(StandardCharsets.UTF_8);
            if (body.length > maxResponseBytes) {
                throw new GatewayException(ErrorCode.RESPONSE_TOO_LARGE, "reply exceeds " + maxResponseBytes + " bytes");
            }
            HttpHeaders h = new HttpHeaders();
            h.setContentType(MediaType.APPLICATION_JSON);
            return new HttpPayload(status, h, body);
        }
    }
}
