package org.iceforge.bifrost.gateway.clickhouse;

import org.iceforge.bifrost.gateway.listener.FakeHttpBackend;
import org.iceforge.bifrost.gateway.listener.ListenerLifecycle;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.registry.NewConnector;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ClickHouseListenerTest {

    @Autowired
    private ConnectorRegistry registry;

    @Autowired
    private ListenerLifecycle listeners;

    private FakeHttpBackend backend;
    private ProxyConnector connector;
    private WebClient http;

    @BeforeEach
    void setUp() {
        backend = new FakeHttpBackend(200, "text/tab-separated-values", "1\n");
        connector = registry.register(new NewConnector("ch-owner", "events", null, ConnectorType.COLUMNAR,
                ConnectorSecrets.of(Map.of("base_url", backend.baseUrl(), "username", "analytics", "password", "ch-pw")),
                null, false));
        http = WebClient.create("http://127.0.0.1:" + listeners.port(Protocol.CLICKHOUSE));
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private ResponseEntity<String> query(String sql) {
        return http.post().uri("/?user=" + connector.accessToken() + "&database=events")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(sql)
                .exchangeToMono(r -> r.toEntity(String.class))
                .block(Duration.ofSeconds(10));
    }

    @Test
    void selectIsForwardedUnderTheBackendUser() {
        ResponseEntity<String> r = query("SELECT count() FROM hits");

        assertThat(r.getStatusCode().value()).isEqualTo(200);
        assertThat(r.getBody()).isEqualTo("1\n");
        FakeHttpBackend.Received got = backend.last();
        assertThat(got.body()).isEqualTo("SELECT count() FROM hits");
        assertThat(got.headers().get("X-ClickHouse-User")).isEqualTo("analytics");
        assertThat(got.headers().get("X-ClickHouse-Key")).isEqualTo("ch-pw");
        assertThat(got.uri()).doesNotContain("user=").contains("database=events");
    }

    @Test
    void writeIsRefusedInClickHouseFormat() {
        ResponseEntity<String> r = query("DROP TABLE hits");

        assertThat(r.getStatusCode().value()).isEqualTo(403);
        assertThat(r.getHeaders().getFirst(ClickHouseAdapter.EXCEPTION_CODE_HEADER)).isEqualTo("497");
        assertThat(r.getBody()).startsWith("Code: 497.");
        assertThat(backend.received()).isEmpty();
    }

    @Test
    void wrongUserIsAuthenticationFailure() {
        ResponseEntity<String> r = http.post().uri("/?user=nobody")
                .bodyValue("SELECT 1")
                .exchangeToMono(resp -> resp.toEntity(String.class))
                .block(Duration.ofSeconds(10));

        assertThat(r.getHeaders().getFirst(ClickHouseAdapter.EXCEPTION_CODE_HEADER)).isEqualTo("516");
    }
}
