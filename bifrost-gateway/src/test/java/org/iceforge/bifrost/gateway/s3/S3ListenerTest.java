package org.iceforge.bifrost.gateway.s3;

import org.iceforge.bifrost.gateway.listener.ListenerLifecycle;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.registry.NewConnector;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/** Object-store listener over a mocked S3 client. */
@SpringBootTest
@ActiveProfiles("test")
class S3ListenerTest {

    @Autowired
    private ConnectorRegistry registry;

    @Autowired
    private ListenerLifecycle listeners;

    @MockBean
    private S3ClientFactory clients;

    private S3Client s3;
    private ProxyConnector connector;
    private WebClient http;

    @BeforeEach
    void setUp() {
        s3 = mock(S3Client.class);
        when(clients.create(any())).thenReturn(s3);
        connector = registry.register(new NewConnector("s3-owner", "lake", null, ConnectorType.OBJECT_STORE,
                ConnectorSecrets.of(Map.of("bucket", "data-lake", "prefix", "team-a", "region", "eu-west-1")),
                null, false));
        http = WebClient.create("http://127.0.0.1:" + listeners.port(Protocol.S3));
    }

    private ResponseEntity<String> call(HttpMethod method, String path) {
        return http.method(method).uri("/" + connector.accessToken() + path)
                .exchangeToMono(r -> r.toEntity(String.class))
                .block(Duration.ofSeconds(10));
    }

    @Test
    void getReadsUnderTheConnectorPrefix() {
        byte[] data = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        when(s3.getObject(any(GetObjectRequest.class))).thenReturn(new ResponseInputStream<>(
                GetObjectResponse.builder().contentType("text/csv").contentLength((long) data.length).build(),
                new ByteArrayInputStream(data)));

        ResponseEntity<String> r = call(HttpMethod.GET, "/reports/q1.csv");

        assertThat(r.getStatusCode().value()).isEqualTo(200);
        assertThat(r.getBody()).isEqualTo("a,b\n1,2\n");
        ArgumentCaptor<GetObjectRequest> req = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3).getObject(req.capture());
        assertThat(req.getValue().bucket()).isEqualTo("data-lake");
        assertThat(req.getValue().key()).isEqualTo("team-a/reports/q1.csv");
    }

    @Test
    void listingHidesThePrefix() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("team-a/reports/q1.csv").size(8L)
                        .lastModified(Instant.parse("2026-01-01T00:00:00Z")).eTag("\"e1\"").build())
                .isTruncated(false)
                .build());

        ResponseEntity<String> r = call(HttpMethod.GET, "/reports/");

        assertThat(r.getStatusCode().value()).isEqualTo(200);
        assertThat(r.getBody()).contains("<Key>reports/q1.csv</Key>").doesNotContain("team-a");
        ArgumentCaptor<ListObjectsV2Request> req = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3).listObjectsV2(req.capture());
        assertThat(req.getValue().prefix()).isEqualTo("team-a/reports/");
    }

    @Test
    void missingObjectIsS3Error() {
        when(s3.getObject(any(GetObjectRequest.class))).thenThrow((S3Exception) S3Exception.builder()
                .statusCode(404)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("NoSuchKey").build())
                .build());

        ResponseEntity<String> r = call(HttpMethod.GET, "/nope.csv");

        assertThat(r.getStatusCode().value()).isEqualTo(404);
        assertThat(r.getBody()).contains("NoSuchKey");
    }

    @Test
    void writesAreRefusedByDefault() {
        ResponseEntity<String> r = http.put().uri("/" + connector.accessToken() + "/new.csv")
                .bodyValue("x")
                .exchangeToMono(resp -> resp.toEntity(String.class))
                .block(Duration.ofSeconds(10));

        assertThat(r.getStatusCode().value()).isEqualTo(403);
        verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }
}
