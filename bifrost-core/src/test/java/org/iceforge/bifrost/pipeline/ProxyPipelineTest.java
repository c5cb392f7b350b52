package org.iceforge.bifrost.pipeline;

import org.iceforge.bifrost.CoreFixture;
import org.iceforge.bifrost.audit.AccessEvent;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.error.MalformedRequestException;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.token.ClientCredentials;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProxyPipelineTest {

    record Req(String token, String sql) {}

    /** SQL-ish adapter: first word is the operation, responses and errors are appended to a list. */
    static final class FakeSqlAdapter implements ProtocolAdapter<Req, String, List<String>> {
        @Override
        public Protocol protocol() {
            return Protocol.MYSQL;
        }

        @Override
        public ClientCredentials parseToken(Req request) {
            return ClientCredentials.ofToken(request.token());
        }

        @Override
        public String parseOperation(Req request) {
            if (request.sql() == null || request.sql().isBlank()) {
                throw new MalformedRequestException("empty statement");
            }
            if (request.sql().contains(";")) {
                throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "one statement per query");
            }
            return request.sql().trim().split("\\s+")[0];
        }

        @Override
        public boolean isReadOnly(String operation) {
            return operation.toUpperCase(Locale.ROOT).equals("SELECT");
        }

        @Override
        public long frameResponse(String backendResult, List<String> out) {
            out.add("OK " + backendResult);
            return backendResult.length();
        }

        @Override
        public void frameError(GatewayException error, List<String> out) {
            out.add("ERR " + error.code());
        }
    }

    private final CoreFixture fx = new CoreFixture();
    private final FakeSqlAdapter adapter = new FakeSqlAdapter();
    private final AtomicInteger backendCalls = new AtomicInteger();
    private final List<String> out = new ArrayList<>();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private ProxyResult run(String token, String sql, BackendInvoker<Req, String> backend) throws Exception {
        return fx.pipeline.handle(adapter, new Req(token, sql), new ClientContext("10.0.0.9:5555"), backend, out);
    }

    private BackendInvoker<Req, String> echo() {
        return (req, grant) -> {
            backendCalls.incrementAndGet();
            return grant.credentials().withSecrets(s -> s.require("host")) + ":" + req.sql();
        };
    }

    @Test
    void rejectedOperation_neverReachesBackend() throws Exception {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");

        ProxyResult r = run(c.accessToken(), "INSERT INTO t VALUES (1)", echo());

        assertThat(r.outcome()).isEqualTo(AccessEvent.Outcome.REJECTED);
        assertThat(r.error()).isEqualTo(ErrorCode.OPERATION_NOT_ALLOWED);
        assertThat(backendCalls.get()).isZero();
        assertThat(out).containsExactly("ERR OPERATION_NOT_ALLOWED");
        assertThat(fx.totalRequests(c.id())).isZero();
    }

    @Test
    void allowedOperation_isRelayed_counted_andAudited() throws Exception {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");

        ProxyResult r = run(c.accessToken(), "select 1", echo());

        assertThat(r.succeeded()).isTrue();
        assertThat(out).containsExactly("OK db.internal:select 1");
        assertThat(backendCalls.get()).isEqualTo(1);
        assertThat(fx.totalRequests(c.id())).isEqualTo(1);
        assertThat(fx.events).singleElement().satisfies(e -> {
            assertThat(e.protocol()).isEqualTo("mysql");
            assertThat(e.connectorId()).isEqualTo(c.id());
            assertThat(e.operation()).isEqualTo("SELECT");
            assertThat(e.outcome()).isEqualTo(AccessEvent.Outcome.SUCCEEDED);
            assertThat(e.caller()).isEqualTo(AccessEvent.ANONYMOUS);
            assertThat(e.remoteAddress()).isEqualTo("10.0.0.9:5555");
            assertThat(e.bytes()).isEqualTo("db.internal:select 1".length());
        });
        assertThat(fx.usage.stats().get(c.id()).succeeded()).isEqualTo(1);
    }

    @Test
    void malformedInput_isAuditedAndPropagated_withoutResolving() {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");

        assertThatThrownBy(() -> run(c.accessToken(), "  ", echo()))
                .isInstanceOf(MalformedRequestException.class);

        assertThat(backendCalls.get()).isZero();
        assertThat(fx.totalRequests(c.id())).isZero();
        assertThat(fx.events).singleElement()
                .extracting(AccessEvent::errorCode).isEqualTo(ErrorCode.MALFORMED_REQUEST);
    }

    @Test
    void unacceptableInput_isFramedAsError_andSessionKeepsWorking() throws Exception {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");

        ProxyResult r = run(c.accessToken(), "SELECT 1; DELETE FROM t", echo());

        assertThat(r.outcome()).isEqualTo(AccessEvent.Outcome.REJECTED);
        assertThat(r.error()).isEqualTo(ErrorCode.INVALID_ARGUMENT);
        assertThat(out).containsExactly("ERR INVALID_ARGUMENT");
        assertThat(backendCalls.get()).isZero();
        assertThat(fx.totalRequests(c.id())).isZero();
        assertThat(fx.events).singleElement()
                .extracting(AccessEvent::errorCode).isEqualTo(ErrorCode.INVALID_ARGUMENT);
    }

    @Test
    void readOnlyOperation_isRetriedOnce_onUnreachableBackend() throws Exception {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");
        BackendInvoker<Req, String> flaky = (req, grant) -> {
            if (backendCalls.incrementAndGet() == 1) {
                throw new GatewayException(ErrorCode.BACKEND_UNREACHABLE, "connection refused");
            }
            return "rows";
        };

        ProxyResult r = run(c.accessToken(), "SELECT * FROM t", flaky);

        assertThat(r.succeeded()).isTrue();
        assertThat(backendCalls.get()).isEqualTo(2);
        assertThat(fx.totalRequests(c.id())).isEqualTo(1);
    }

    @Test
    void writeOperation_isNeverRetried() throws Exception {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT", "UPDATE");
        BackendInvoker<Req, String> down = (req, grant) -> {
            backendCalls.incrementAndGet();
            throw new GatewayException(ErrorCode.BACKEND_TIMEOUT, "no answer");
        };

        ProxyResult r = run(c.accessToken(), "UPDATE t SET a = 1", down);

        assertThat(r.outcome()).isEqualTo(AccessEvent.Outcome.FAILED);
        assertThat(r.error()).isEqualTo(ErrorCode.BACKEND_TIMEOUT);
        assertThat(backendCalls.get()).isEqualTo(1);
        assertThat(out).containsExactly("ERR BACKEND_TIMEOUT");
    }

    @Test
    void backendFailure_stillCountsTheAcceptedAttempt() throws Exception {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");
        SharedLink link = fx.link(c, 2, null);
        BackendInvoker<Req, String> broken = (req, grant) -> {
            backendCalls.incrementAndGet();
            throw new IllegalStateException("socket reset");
        };

        ProxyResult r = run(link.shareId(), "SELECT 1", broken);

        assertThat(r.error()).isEqualTo(ErrorCode.BACKEND_UNREACHABLE);
        // one try plus one read-only retry, both under the same accepted attempt
        assertThat(backendCalls.get()).isEqualTo(2);
        assertThat(fx.linkStore.findById(link.shareId()).orElseThrow().currentUses()).isEqualTo(1);
    }

    @Test
    void scenario_linkWithMaxUsesThree_fourthUseIsExhausted() throws Exception {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");
        SharedLink link = fx.link(c, 3, null);

        for (int i = 0; i < 3; i++) {
            assertThat(run(link.shareId(), "SELECT 1", echo()).succeeded()).isTrue();
        }
        ProxyResult fourth = run(link.shareId(), "SELECT 1", echo());

        assertThat(fourth.error()).isEqualTo(ErrorCode.TOKEN_EXHAUSTED);
        assertThat(backendCalls.get()).isEqualTo(3);
        assertThat(fx.events).filteredOn(e -> e.outcome() == AccessEvent.Outcome.REJECTED)
                .singleElement().extracting(AccessEvent::errorCode).isEqualTo(ErrorCode.TOKEN_EXHAUSTED);
    }

    @Test
    void authenticate_auditsFailedLogins() {
        assertThatThrownBy(() -> fx.pipeline.authenticate(Protocol.POSTGRESQL, ClientCredentials.ofToken("bogus"),
                new ClientContext("1.2.3.4:1")))
                .isInstanceOf(GatewayException.class);

        assertThat(fx.events).singleElement().satisfies(e -> {
            assertThat(e.operation()).isEqualTo("LOGIN");
            assertThat(e.errorCode()).isEqualTo(ErrorCode.TOKEN_NOT_FOUND);
        });
    }
}
