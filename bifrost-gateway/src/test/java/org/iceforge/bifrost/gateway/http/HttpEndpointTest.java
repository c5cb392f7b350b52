package org.iceforge.bifrost.gateway.http;

import org.iceforge.bifrost.error.MalformedRequestException;
import org.iceforge.bifrost.gateway.listener.HttpCalls;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpEndpointTest {

    private final HttpEndpoint endpoint = new HttpEndpoint("https://api.internal/v1/", Map.of());

    @Test
    void pathAndQueryAreAppendedUnderTheBase() {
        assertThat(endpoint.resolve("/items/42", "limit=5"))
                .hasToString("https://api.internal/v1/items/42?limit=5");
        assertThat(endpoint.resolve("items", null)).hasToString("https://api.internal/v1/items");
        assertThat(endpoint.resolve("", "")).hasToString("https://api.internal/v1");
    }

    @Test
    void dotSegmentsAreRejected() {
        for (String path : new String[] {"/../admin", "/a/./b", "/a/..", "..", "/%2e%2E/admin", "/a/.%2e/b"}) {
            assertThatThrownBy(() -> endpoint.resolve(path, null))
                    .as(path)
                    .isInstanceOf(MalformedRequestException.class);
        }
    }

    @Test
    void dotsInsideASegmentAreKept() {
        assertThat(HttpEndpoint.checkedPath("/files/report..v2/.hidden")).isEqualTo("/files/report..v2/.hidden");
    }

    @Test
    void illegalPathSyntaxIsMalformedNotABackendFailure() {
        assertThatThrownBy(() -> HttpEndpoint.checkedPath("/a b")).isInstanceOf(MalformedRequestException.class);
        assertThatThrownBy(() -> HttpEndpoint.checkedPath("/%zz")).isInstanceOf(MalformedRequestException.class);
        assertThatThrownBy(() -> HttpEndpoint.checkedPath("//other-host/x")).isInstanceOf(MalformedRequestException.class);
    }

    @Test
    void apiRequestsAreCheckedWhileParsing() {
        ApiAdapter adapter = new ApiAdapter(null);

        assertThat(adapter.parseOperation(HttpCalls.of("get", "/items?x=1"))).isEqualTo("GET");
        assertThatThrownBy(() -> adapter.parseOperation(HttpCalls.of("GET", "/../admin")))
                .isInstanceOf(MalformedRequestException.class);
    }
}
