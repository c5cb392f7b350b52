package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
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
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/** OP_MSG conversations with the MongoDB listener; the backend is a mock. */
@SpringBootTest
@ActiveProfiles("test")
class MongoListenerTest {

    @Autowired
    private ConnectorRegistry registry;

    @Autowired
    private ListenerLifecycle listeners;

    @MockBean
    private MongoBackend backend;

    private ProxyConnector connector;
    private Socket socket;
    private InputStream in;
    private OutputStream out;

    @BeforeEach
    void setUp() throws IOException {
        connector = registry.register(new NewConnector("mongo-owner", "events", null, ConnectorType.DOCUMENT,
                ConnectorSecrets.of(Map.of("host", "mongo.internal")), Set.of("FIND"), false));
        socket = new Socket("127.0.0.1", listeners.port(Protocol.MONGODB));
        socket.setSoTimeout(5_000);
        in = socket.getInputStream();
        out = socket.getOutputStream();
    }

    @AfterEach
    void tearDown() throws IOException {
        socket.close();
    }

    private BsonDocument send(BsonDocument command) throws IOException {
        MongoWire.writeMsg(out, 0, command.append("$db", new BsonString("app")));
        return MongoWire.decodeMsg(MongoWire.read(in)).document();
    }

    private BsonDocument login(String token) throws IOException {
        byte[] payload = ("\0" + token + "\0").getBytes(StandardCharsets.UTF_8);
        return send(new BsonDocument("saslStart", new BsonInt32(1))
                .append("mechanism", new BsonString("PLAIN"))
                .append("payload", new BsonBinary(payload)));
    }

    private static double ok(BsonDocument reply) {
        return reply.getNumber("ok").doubleValue();
    }

    @Test
    void handshakeIsAnsweredLocally() throws IOException {
        BsonDocument hello = send(new BsonDocument("hello", new BsonInt32(1))
                .append("saslSupportedMechs", new BsonString("app.user")));

        assertThat(ok(hello)).isEqualTo(1.0);
        assertThat(hello.getInt32("maxWireVersion").getValue()).isEqualTo(17);
        assertThat(hello.getArray("saslSupportedMechs")).containsExactly(new BsonString("PLAIN"));
        assertThat(ok(send(new BsonDocument("ping", new BsonInt32(1))))).isEqualTo(1.0);
    }

    @Test
    void commandsNeedLogin() throws IOException {
        BsonDocument reply = send(new BsonDocument("find", new BsonString("events")));

        assertThat(ok(reply)).isZero();
        assertThat(reply.getInt32("code").getValue()).isEqualTo(MongoErrors.UNAUTHORIZED);
        verify(backend, never()).run(any(), any());
    }

    @Test
    void unknownTokenFailsLogin() throws IOException {
        BsonDocument reply = login("no-such-token");

        assertThat(reply.getInt32("code").getValue()).isEqualTo(MongoErrors.AUTHENTICATION_FAILED);
    }

    @Test
    void allowedCommandReachesBackend() throws IOException {
        BsonDocument cursor = new BsonDocument("cursor", new BsonDocument("id", new BsonInt64(0))
                .append("ns", new BsonString("app.events"))
                .append("firstBatch", new BsonArray(List.of(new BsonDocument("kind", new BsonString("click"))))))
                .append("ok", new BsonInt32(1));
        when(backend.run(any(), any())).thenReturn(cursor);

        assertThat(login(connector.accessToken()).getBoolean("done").getValue()).isTrue();
        BsonDocument reply = send(new BsonDocument("find", new BsonString("events"))
                .append("lsid", new BsonDocument("id", new BsonString("client-session"))));

        assertThat(reply.getDocument("cursor").getArray("firstBatch")).hasSize(1);
        verify(backend).run(argThat(r -> r.database().equals("app")
                && r.operation().equals("FIND")
                && !r.command().containsKey("lsid")
                && !r.command().containsKey("$db")), any());
    }

    @Test
    void commandOutsideAllowListIsRefused() throws IOException {
        login(connector.accessToken());

        BsonDocument reply = send(new BsonDocument("drop", new BsonString("events")));

        assertThat(ok(reply)).isZero();
        assertThat(reply.getInt32("code").getValue()).isEqualTo(MongoErrors.UNAUTHORIZED);
        verify(backend, never()).run(any(), any());
    }

    @Test
    void logoutDropsTheLogin() throws IOException {
        login(connector.accessToken());
        send(new BsonDocument("logout", new BsonInt32(1)));

        BsonDocument reply = send(new BsonDocument("find", new BsonString("events")));

        assertThat(reply.getInt32("code").getValue()).isEqualTo(MongoErrors.UNAUTHORIZED);
    }

    @Test
    void aggregateWritingACollectionIsRefusedOnDefaultConnector() throws IOException {
        ProxyConnector readOnly = registry.register(new NewConnector("mongo-owner", "defaults", null,
                ConnectorType.DOCUMENT, ConnectorSecrets.of(Map.of("host", "mongo.internal")), null, false));
        when(backend.run(any(), any())).thenReturn(new BsonDocument("cursor", new BsonDocument("id", new BsonInt64(0))
                .append("ns", new BsonString("app.events"))
                .append("firstBatch", new BsonArray()))
                .append("ok", new BsonInt32(1)));
        login(readOnly.accessToken());

        BsonDocument refused = send(new BsonDocument("aggregate", new BsonString("events"))
                .append("pipeline", new BsonArray(List.of(new BsonDocument("$out", new BsonString("copy")))))
                .append("cursor", new BsonDocument()));
        assertThat(code(refused)).isEqualTo(MongoErrors.UNAUTHORIZED);
        verify(backend, never()).run(any(), any());

        BsonDocument plain = send(new BsonDocument("aggregate", new BsonString("events"))
                .append("pipeline", new BsonArray(List.of(new BsonDocument("$match", new BsonDocument()))))
                .append("cursor", new BsonDocument()));
        assertThat(ok(plain)).isEqualTo(1.0);
        verify(backend).run(argThat(r -> r.operation().equals("AGGREGATE")), any());
    }

    private static int code(BsonDocument reply) {
        return reply.getInt32("code").getValue();
    }
}
