package org.iceforge.bifrost.gateway.pgwire;

import org.iceforge.bifrost.links.NewSharedLink;
import org.iceforge.bifrost.links.SharedLinkManager;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.model.SharingLevel;
import org.iceforge.bifrost.gateway.jdbc.JdbcBackend;
import org.iceforge.bifrost.gateway.jdbc.JdbcResult;
import org.iceforge.bifrost.gateway.listener.ListenerLifecycle;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.registry.NewConnector;
import org.iceforge.bifrost.token.AuthorizationRequest;
import org.iceforge.bifrost.token.AuthorizationResult;
import org.iceforge.bifrost.token.ClientCredentials;
import org.iceforge.bifrost.token.TokenResolver;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.DataOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** pgjdbc against the PostgreSQL listener, with an in-memory H2 database as the backend. */
@SpringBootTest
@ActiveProfiles("test")
class PgWireGatewayTest {

    @Autowired
    private ConnectorRegistry registry;

    @Autowired
    private SharedLinkManager links;

    @Autowired
    private ListenerLifecycle listeners;

    @Autowired
    private TokenResolver resolver;

    @Autowired
    private JdbcBackend postgresJdbcBackend;

    private Connection backend;
    private ProxyConnector connector;

    @BeforeEach
    void setUp() throws SQLException {
        String url = "jdbc:h2:mem:pg-backend-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        backend = DriverManager.getConnection(url, "sa", "");
        try (Statement st = backend.createStatement()) {
            st.execute("CREATE TABLE people (id INT PRIMARY KEY, name VARCHAR(64))");
            st.execute("INSERT INTO people VALUES (1, 'ada'), (2, 'grace')");
        }
        connector = registry.register(new NewConnector("pg-owner", "people db", null, ConnectorType.RELATIONAL_B,
                ConnectorSecrets.of(Map.of("jdbc_url", url, "username", "sa", "password", "")),
                Set.of("SELECT"), false));
    }

    @AfterEach
    void tearDown() throws SQLException {
        backend.close();
    }

    private Connection connect(String user, String password) throws SQLException {
        Properties p = new Properties();
        p.setProperty("user", user);
        if (password != null) {
            p.setProperty("password", password);
        }
        p.setProperty("sslmode", "disable");
        p.setProperty("preferQueryMode", "simple");
        p.setProperty("connectTimeout", "5");
        return DriverManager.getConnection(
                "jdbc:postgresql://127.0.0.1:" + listeners.port(Protocol.POSTGRESQL) + "/people", p);
    }

    private int backendRows() throws SQLException {
        try (Statement st = backend.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM people")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private static List<String> names(Connection c) throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT id, name FROM people ORDER BY id")) {
            while (rs.next()) {
                names.add(rs.getInt(1) + ":" + rs.getString(2));
            }
        }
        return names;
    }

    @Test
    void selectWithConnectorToken() throws SQLException {
        try (Connection c = connect(connector.accessToken(), null)) {
            assertThat(names(c)).containsExactly("1:ada", "2:grace");
        }
        assertThat(registry.get("pg-owner", connector.id()).totalRequests()).isEqualTo(1);
    }

    @Test
    void operationOutsideAllowListIsRefusedAndBackendUntouched() throws SQLException {
        try (Connection c = connect(connector.accessToken(), null); Statement st = c.createStatement()) {
            assertThatThrownBy(() -> st.execute("DELETE FROM people"))
                    .isInstanceOfSatisfying(SQLException.class,
                            e -> assertThat(e.getSQLState()).isEqualTo("42501"));
            // the session survives a refused statement
            assertThat(names(c)).hasSize(2);
        }
        try (Statement st = backend.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM people")) {
            rs.next();
            assertThat(rs.getInt(1)).isEqualTo(2);
        }
    }

    @Test
    void unknownTokenCannotLogIn() {
        assertThatThrownBy(() -> connect("not-a-token", null)).isInstanceOf(SQLException.class);
    }

    @Test
    void passwordProtectedLink() throws SQLException {
        SharedLink link = links.create(new NewSharedLink(LinkTarget.connector(connector.id()), "pw link", null,
                "pg-owner", SharingLevel.PUBLIC, null, "open sesame", null, null, null));

        assertThatThrownBy(() -> connect(link.shareId(), null)).isInstanceOf(SQLException.class);
        assertThatThrownBy(() -> connect(link.shareId(), "wrong")).isInstanceOf(SQLException.class);
        try (Connection c = connect(link.shareId(), "open sesame")) {
            assertThat(names(c)).hasSize(2);
        }
    }

    @Test
    void linkStopsWorkingOnceUsesRunOut() throws SQLException {
        SharedLink link = links.create(new NewSharedLink(LinkTarget.connector(connector.id()), "one shot", null,
                "pg-owner", SharingLevel.PUBLIC, null, null, null, 1, null));

        try (Connection c = connect(link.shareId(), null)) {
            assertThat(names(c)).hasSize(2);
            assertThatThrownBy(() -> names(c))
                    .isInstanceOfSatisfying(SQLException.class,
                            e -> assertThat(e.getSQLState()).isEqualTo("28000"));
        }
    }

    @Test
    void stackedStatementsAreRefusedAndBackendUntouched() throws SQLException {
        try (Connection c = connect(connector.accessToken(), null); Statement st = c.createStatement()) {
            assertThatThrownBy(() -> st.execute("SELECT 1; DELETE FROM people"))
                    .isInstanceOfSatisfying(SQLException.class,
                            e -> assertThat(e.getSQLState()).isEqualTo("22023"));
            assertThatThrownBy(() -> st.execute("select 1 /* ; */ ; delete from people;"))
                    .isInstanceOf(SQLException.class);
            assertThat(names(c)).hasSize(2);
        }
        assertThat(backendRows()).isEqualTo(2);
    }

    @Test
    void dataChangingCteNeedsTheWriteVerb() throws SQLException {
        try (Connection c = connect(connector.accessToken(), null); Statement st = c.createStatement()) {
            assertThatThrownBy(() -> st.execute("WITH d AS (DELETE FROM people RETURNING *) SELECT * FROM d"))
                    .isInstanceOfSatisfying(SQLException.class,
                            e -> assertThat(e.getSQLState()).isEqualTo("42501"));
        }
        assertThat(backendRows()).isEqualTo(2);
    }

    @Test
    void readOnlyConnectorStatementsAreRolledBack() throws SQLException {
        AuthorizationRequest req = new AuthorizationRequest(ClientCredentials.ofToken(connector.accessToken()),
                "SELECT", Set.of(ConnectorType.RELATIONAL_B), false);
        try (AuthorizationResult grant = resolver.authorize(req);
             JdbcResult result = postgresJdbcBackend.execute("INSERT INTO people VALUES (3, 'linus')", grant)) {
            assertThat(result.isError()).isFalse();
            assertThat(result.updateCount()).isEqualTo(1);
        }
        assertThat(backendRows()).isEqualTo(2);
    }

    @Test
    void oversizedMessageEndsTheSession() throws IOException {
        try (Socket socket = new Socket("127.0.0.1", listeners.port(Protocol.POSTGRESQL))) {
            socket.setSoTimeout(5_000);
            DataOutputStream out = new DataOutputStream(socket.getOutputStream());
            byte[] params = ("user\0" + connector.accessToken() + "\0database\0people\0\0")
                    .getBytes(StandardCharsets.UTF_8);
            out.writeInt(8 + params.length);
            out.writeInt(196608);
            out.write(params);
            // simple query claiming just under 2 GiB; the body is never sent
            out.writeByte('Q');
            out.writeInt(Integer.MAX_VALUE);
            out.flush();

            String replies = new String(socket.getInputStream().readAllBytes(), StandardCharsets.ISO_8859_1);
            assertThat(replies).contains("08P01");
        }
    }
}
