package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.jdbc.JdbcBackend;
import org.iceforge.bifrost.pipeline.ClientContext;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.iceforge.bifrost.token.ClientCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One client connection on the MySQL listener.
 *
 * <p>The handshake username is the proxy token. When the link has a password the client is
 * switched to {@code mysql_clear_password} to send it. An identity token may be passed as the
 * {@code identity} connection attribute. Only the text protocol is served: COM_QUERY, COM_PING,
 * COM_INIT_DB, COM_RESET_CONNECTION and COM_QUIT.
 */
final class MySqlSession implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(MySqlSession.class);

    private static final int COM_QUIT = 0x01;
    private static final int COM_INIT_DB = 0x02;
    private static final int COM_QUERY = 0x03;
    private static final int COM_PING = 0x0E;
    private static final int COM_STMT_PREPARE = 0x16;
    private static final int COM_SET_OPTION = 0x1B;
    private static final int COM_RESET_CONNECTION = 0x1F;

    private static final int ER_EMPTY_QUERY = 1065;

    private static final AtomicInteger CONNECTION_IDS = new AtomicInteger();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Socket socket;
    private final ProxyPipeline pipeline;
    private final JdbcBackend backend;
    private final MySqlSqlAdapter adapter;
    private final Duration idleTimeout;
    private final ClientContext client;

    private ClientCredentials credentials;

    MySqlSession(Socket socket, ProxyPipeline pipeline, JdbcBackend backend, MySqlSqlAdapter adapter,
                 Duration idleTimeout) {
        this.socket = Objects.requireNonNull(socket);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.backend = Objects.requireNonNull(backend);
        this.adapter = Objects.requireNonNull(adapter);
        this.idleTimeout = Objects.requireNonNull(idleTimeout);
        this.client = ClientContext.of(socket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        try (InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = new BufferedOutputStream(socket.getOutputStream())) {
            MySqlPacketIO io = new MySqlPacketIO(in, out);
            io.limit(MySqlPacketIO.HANDSHAKE_REQUEST_BYTES);

            MySqlMessages.handshake(io, CONNECTION_IDS.incrementAndGet(), scramble());
            HandshakeResponse response = HandshakeResponse.parse(io.read());
            if ((response.capabilities() & MySqlMessages.CLIENT_PROTOCOL_41) == 0) {
                MySqlMessages.error(io, MySqlErrors.ER_UNKNOWN_COM, "08004", "client protocol 4.1 required");
                io.flush();
                return;
            }

            this.credentials = login(io, response);
            if (this.credentials == null) {
                return;
            }
            MySqlMessages.ok(io, 0);
            io.flush();
            io.limit(MySqlPacketIO.MAX_REQUEST_BYTES);
            socket.setSoTimeout((int) idleTimeout.toMillis());

            loop(io);
        } catch (EOFException eof) {
            log.debug("mysql client {} disconnected", client.remoteAddress());
        } catch (Exception e) {
            log.debug("mysql session {} ended with error: {}", client.remoteAddress(), e.toString());
        }
    }

    private ClientCredentials login(MySqlPacketIO io, HandshakeResponse response) throws IOException {
        String password = MySqlMessages.CLEAR_PASSWORD.equals(response.plugin())
                ? cstring(response.authResponse())
                : null;
        ClientCredentials creds = new ClientCredentials(response.user(), password, response.attributes().get("identity"));
        try {
            pipeline.authenticate(Protocol.MYSQL, creds, client);
            return creds;
        } catch (GatewayException e) {
            if (e.code() != ErrorCode.PASSWORD_REQUIRED) {
                loginFailed(io, e);
                return null;
            }
        }

        MySqlMessages.authSwitch(io, MySqlMessages.CLEAR_PASSWORD);
        ClientCredentials withPassword = creds.withPassword(cstring(io.read()));
        try {
            pipeline.authenticate(Protocol.MYSQL, withPassword, client);
            return withPassword;
        } catch (GatewayException e) {
            loginFailed(io, e);
            return null;
        }
    }

    private static void loginFailed(MySqlPacketIO io, GatewayException e) throws IOException {
        MySqlErrors.Native n = MySqlErrors.of(e.code());
        MySqlMessages.error(io, n.errno(), n.sqlState(), e.code().publicMessage());
        io.flush();
    }

    private void loop(MySqlPacketIO io) throws IOException {
        while (true) {
            byte[] packet = io.read();
            if (packet.length == 0) {
                return;
            }
            int command = packet[0] & 0xFF;
            if (log.isDebugEnabled()) {
                log.debug("mysql <= command=0x{} len={}", Integer.toHexString(command), packet.length);
            }
            switch (command) {
                case COM_QUIT -> {
                    return;
                }
                case COM_PING, COM_INIT_DB, COM_RESET_CONNECTION -> MySqlMessages.ok(io, 0);
                case COM_SET_OPTION -> MySqlMessages.eof(io);
                case COM_QUERY -> query(io, new String(packet, 1, packet.length - 1, StandardCharsets.UTF_8));
                case COM_STMT_PREPARE -> MySqlMessages.error(io, MySqlErrors.ER_UNSUPPORTED_PS, "HY000",
                        "prepared statements are not supported, use the text protocol");
                default -> MySqlMessages.error(io, MySqlErrors.ER_UNKNOWN_COM, "08S01",
                        "unsupported command 0x" + Integer.toHexString(command));
            }
            io.flush();
        }
    }

    private void query(MySqlPacketIO io, String raw) throws IOException {
        String sql = raw.trim();
        if (sql.isEmpty()) {
            MySqlMessages.error(io, ER_EMPTY_QUERY, "42000", "Query was empty");
            return;
        }
        Optional<MySqlSessionVariables.Answer> local = MySqlSessionVariables.answer(sql);
        if (local.isPresent()) {
            MySqlSessionVariables.Answer answer = local.get();
            if (answer.isOk()) {
                MySqlMessages.ok(io, 0);
            } else {
                MySqlMessages.textResult(io, answer.columns(), answer.values());
            }
            return;
        }
        pipeline.handle(adapter, new MySqlQuery(credentials, sql), client,
                (q, grant) -> backend.execute(q.sql(), grant), new MySqlOutput(io));
    }

    /** 20 bytes of printable, non-zero auth data. */
    private static byte[] scramble() {
        byte[] b = new byte[20];
        for (int i = 0; i < b.length; i++) {
            b[i] = (byte) (33 + RANDOM.nextInt(94));
        }
        return b;
    }

    private static String cstring(byte[] b) {
        int n = 0;
        while (n < b.length && b[n] != 0) n++;
        return new String(b, 0, n, StandardCharsets.UTF_8);
    }

    /** HandshakeResponse41 fields the gateway uses. */
    record HandshakeResponse(int capabilities, String user, byte[] authResponse, String database, String plugin,
                             Map<String, String> attributes) {

        static HandshakeResponse parse(byte[] payload) {
            MySqlReader r = new MySqlReader(payload);
            int caps = (int) r.int4();
            if ((caps & MySqlMessages.CLIENT_PROTOCOL_41) == 0) {
                return new HandshakeResponse(caps, null, new byte[0], null, null, Map.of());
            }
            r.int4(); // max packet size
            r.int1(); // charset
            r.skip(23);
            String user = r.cstring();

            byte[] auth;
            if ((caps & MySqlMessages.CLIENT_PLUGIN_AUTH_LENENC) != 0) {
                auth = r.bytes((int) r.lenenc());
            } else if ((caps & MySqlMessages.CLIENT_SECURE_CONNECTION) != 0) {
                auth = r.bytes(r.int1());
            } else {
                auth = r.cstring().getBytes(StandardCharsets.UTF_8);
            }

            String database = null;
            if ((caps & MySqlMessages.CLIENT_CONNECT_WITH_DB) != 0 && r.hasRemaining()) {
                database = r.cstring();
            }
            String plugin = null;
            if ((caps & MySqlMessages.CLIENT_PLUGIN_AUTH) != 0 && r.hasRemaining()) {
                plugin = r.cstring();
            }
            Map<String, String> attrs = new HashMap<>();
            if ((caps & MySqlMessages.CLIENT_CONNECT_ATTRS) != 0 && r.hasRemaining()) {
                long total = r.lenenc();
                int end = r.position() + (int) total;
                while (r.position() < end) {
                    attrs.put(r.lenencString(), r.lenencString());
                }
            }
            return new HandshakeResponse(caps, user, auth, database, plugin, attrs);
        }
    }
}
