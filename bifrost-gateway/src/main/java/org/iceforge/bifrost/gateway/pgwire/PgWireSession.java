package org.iceforge.bifrost.gateway.pgwire;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.error.MalformedRequestException;
import org.iceforge.bifrost.gateway.jdbc.JdbcBackend;
import org.iceforge.bifrost.gateway.jdbc.SqlVerbs;
import org.iceforge.bifrost.pipeline.ClientContext;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.iceforge.bifrost.token.ClientCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One client connection on the PostgreSQL listener.
 *
 * <p>The startup {@code user} is the proxy token; a link password is collected with a
 * cleartext password request only when the link has one. An identity token may be passed
 * as the {@code identity} startup parameter or as {@code -c identity=...} in {@code options}.
 * Session setup statements are answered locally. Everything else goes through the proxy
 * pipeline, one authorization per statement.
 */
final class PgWireSession implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(PgWireSession.class);

    private static final int SSL_REQUEST = 80877103;
    private static final int CANCEL_REQUEST = 80877102;
    private static final int PROTOCOL_3 = 196608;
    private static final int MAX_STARTUP_LENGTH = 10_000;
    static final int MAX_MESSAGE_BYTES = 64 * 1024 * 1024;

    private final Socket socket;
    private final ProxyPipeline pipeline;
    private final JdbcBackend backend;
    private final PgSqlAdapter adapter;
    private final Duration idleTimeout;
    private final ClientContext client;

    private ClientCredentials credentials;

    // Extended query state.
    private final Map<String, String> statements = new HashMap<>();
    private final Map<String, String> portals = new HashMap<>();
    private String describedPortal;
    private boolean skipUntilSync;

    PgWireSession(Socket socket, ProxyPipeline pipeline, JdbcBackend backend, PgSqlAdapter adapter, Duration idleTimeout) {
        this.socket = Objects.requireNonNull(socket);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.backend = Objects.requireNonNull(backend);
        this.adapter = Objects.requireNonNull(adapter);
        this.idleTimeout = Objects.requireNonNull(idleTimeout);
        this.client = ClientContext.of(socket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
             DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()))) {

            // Startup packet is untyped: int32 len, int32 protocol/version or special request code.
            ByteBuffer buf = readStartup(in);
            int code = buf.getInt();

            if (code == SSL_REQUEST) {
                out.writeByte('N');
                out.flush();
                buf = readStartup(in);
                code = buf.getInt();
            }
            if (code == CANCEL_REQUEST) {
                return;
            }
            if (code != PROTOCOL_3) {
                PgMessages.error(out, "FATAL", "0A000", "unsupported frontend protocol");
                out.flush();
                return;
            }

            Map<String, String> params = readStartupParams(buf);
            ClientCredentials creds = new ClientCredentials(params.get("user"), null, identity(params));
            this.credentials = login(in, out, creds);
            if (this.credentials == null) {
                return;
            }
            socket.setSoTimeout((int) idleTimeout.toMillis());

            PgMessages.authOk(out);
            PgMessages.parameterStatus(out, "server_version", "15.0");
            PgMessages.parameterStatus(out, "server_encoding", "UTF8");
            PgMessages.parameterStatus(out, "client_encoding", "UTF8");
            PgMessages.parameterStatus(out, "DateStyle", "ISO, MDY");
            PgMessages.parameterStatus(out, "standard_conforming_strings", "on");
            PgMessages.parameterStatus(out, "integer_datetimes", "on");
            PgMessages.parameterStatus(out, "TimeZone", "UTC");
            PgMessages.backendKeyData(out, ThreadLocalRandom.current().nextInt(1, Integer.MAX_VALUE), 0);
            PgMessages.ready(out);
            out.flush();

            loop(in, out);
        } catch (EOFException eof) {
            log.debug("pgwire client {} disconnected", client.remoteAddress());
        } catch (Exception e) {
            log.debug("pgwire session {} ended with error: {}", client.remoteAddress(), e.toString());
        }
    }

    private ClientCredentials login(DataInputStream in, DataOutputStream out, ClientCredentials creds) throws IOException {
        try {
            pipeline.authenticate(Protocol.POSTGRESQL, creds, client);
            return creds;
        } catch (GatewayException e) {
            if (e.code() != ErrorCode.PASSWORD_REQUIRED) {
                loginFailed(out, e);
                return null;
            }
        }

        PgMessages.authCleartext(out);
        out.flush();
        byte type = in.readByte();
        int len = in.readInt();
        if (type != 'p' || len < 4 || len > MAX_STARTUP_LENGTH) {
            loginFailed(out, new GatewayException(ErrorCode.PASSWORD_REQUIRED, "no password message"));
            return null;
        }
        ClientCredentials withPassword = creds.withPassword(cstring(in.readNBytes(len - 4), 0));
        try {
            pipeline.authenticate(Protocol.POSTGRESQL, withPassword, client);
            return withPassword;
        } catch (GatewayException e) {
            loginFailed(out, e);
            return null;
        }
    }

    private static void loginFailed(DataOutputStream out, GatewayException e) throws IOException {
        PgMessages.error(out, "FATAL", PgErrors.sqlState(e.code()), e.code().publicMessage());
        out.flush();
    }

    private void loop(DataInputStream in, DataOutputStream out) throws IOException {
        while (true) {
            byte type;
            try {
                type = in.readByte();
            } catch (EOFException eof) {
                return;
            }
            int mlen = in.readInt();
            if (mlen < 4) {
                return;
            }
            if (mlen - 4 > MAX_MESSAGE_BYTES) {
                PgMessages.error(out, "FATAL", "08P01", "message exceeds " + MAX_MESSAGE_BYTES + " bytes");
                out.flush();
                throw new MalformedRequestException("pgwire message of " + mlen + " bytes");
            }
            byte[] msg = in.readNBytes(mlen - 4);

            if (log.isDebugEnabled()) {
                log.debug("pgwire <= type={} len={}", (char) type, mlen);
            }

            switch (type) {
                case 'X' -> {
                    return;
                }
                case 'Q' -> {
                    simpleQuery(out, cstring(msg, 0));
                    PgMessages.ready(out);
                    out.flush();
                }
                case 'S' -> {
                    if (describedPortal != null) {
                        PgMessages.noData(out);
                        describedPortal = null;
                    }
                    skipUntilSync = false;
                    PgMessages.ready(out);
                    out.flush();
                }
                case 'H' -> out.flush();
                case 'P', 'B', 'D', 'E', 'C' -> {
                    if (!skipUntilSync) {
                        extended(out, type, ByteBuffer.wrap(msg).order(ByteOrder.BIG_ENDIAN));
                    }
                }
                default -> {
                    PgMessages.error(out, "ERROR", "0A000", "unsupported message type: " + (char) type);
                    PgMessages.ready(out);
                    out.flush();
                }
            }
        }
    }

    private void simpleQuery(DataOutputStream out, String sql) throws IOException {
        String s = sql == null ? "" : sql.trim();
        if (s.isEmpty()) {
            PgMessages.emptyQueryResponse(out);
            return;
        }
        if (answerLocally(out, s, PgOutput.Describe.SIMPLE)) {
            return;
        }
        proxy(new PgOutput(out, SqlVerbs.verb(s), PgOutput.Describe.SIMPLE), s);
    }

    private void extended(DataOutputStream out, byte type, ByteBuffer mb) throws IOException {
        switch (type) {
            case 'P' -> { // Parse
                String name = readCString(mb);
                statements.put(name, readCString(mb));
                PgMessages.parseComplete(out);
            }
            case 'B' -> { // Bind
                String portal = readCString(mb);
                String sql = statements.getOrDefault(readCString(mb), "");
                List<String> values = readBindValues(mb);
                if (values == null) {
                    failExtended(out, "0A000", "binary parameters are not supported");
                    return;
                }
                portals.put(portal, PgParameters.inline(sql, values));
                PgMessages.bindComplete(out);
            }
            case 'D' -> { // Describe
                byte what = mb.get();
                String name = readCString(mb);
                if (what == 'S') {
                    PgMessages.parameterDescription(out, PgParameters.count(statements.get(name)));
                    PgMessages.noData(out);
                } else {
                    // RowDescription is written when the portal executes.
                    describedPortal = name;
                }
            }
            case 'E' -> { // Execute
                String portal = readCString(mb);
                String sql = portals.getOrDefault(portal, "").trim();
                PgOutput.Describe describe = portal.equals(describedPortal)
                        ? PgOutput.Describe.PORTAL
                        : PgOutput.Describe.NONE;
                describedPortal = null;
                if (sql.isEmpty()) {
                    PgMessages.emptyQueryResponse(out);
                } else if (!answerLocally(out, sql, describe)) {
                    PgOutput target = new PgOutput(out, SqlVerbs.verb(sql), describe);
                    proxy(target, sql);
                    skipUntilSync = target.errorSent;
                }
            }
            case 'C' -> { // Close
                byte what = mb.get();
                String name = readCString(mb);
                if (what == 'S') statements.remove(name);
                else portals.remove(name);
                PgMessages.closeComplete(out);
            }
            default -> throw new IllegalArgumentException("not an extended query message: " + (char) type);
        }
    }

    private void failExtended(DataOutputStream out, String sqlState, String message) throws IOException {
        PgMessages.error(out, "ERROR", sqlState, message);
        skipUntilSync = true;
    }

    private void proxy(PgOutput target, String sql) throws IOException {
        pipeline.handle(adapter, new PgQuery(credentials, sql), client,
                (q, grant) -> backend.execute(q.sql(), grant), target);
    }

    /**
     * Session setup that never reaches the backend: SET, SHOW of client settings,
     * version(), transaction control. Each statement is its own transaction on the backend.
     */
    private boolean answerLocally(DataOutputStream out, String sql, PgOutput.Describe describe) throws IOException {
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.endsWith(";")) lower = lower.substring(0, lower.length() - 1).trim();
        String verb = SqlVerbs.verb(lower);

        switch (verb) {
            case "SET", "RESET", "DISCARD", "DEALLOCATE" -> {
                complete(out, describe, verb);
                return true;
            }
            case "BEGIN", "START", "COMMIT", "END", "ROLLBACK", "ABORT" -> {
                complete(out, describe, verb.equals("START") ? "START TRANSACTION" : verb);
                return true;
            }
            case "SHOW" -> {
                String setting = lower.substring(lower.indexOf("show") + 4).trim();
                String value = switch (setting) {
                    case "standard_conforming_strings", "integer_datetimes" -> "on";
                    case "client_encoding", "server_encoding" -> "UTF8";
                    case "datestyle" -> "ISO, MDY";
                    case "timezone" -> "UTC";
                    case "transaction isolation level", "transaction_isolation" -> "read committed";
                    case "server_version" -> "15.0";
                    default -> null;
                };
                if (value == null) return false;
                singleValue(out, describe, setting, value);
                return true;
            }
            default -> {
                if (lower.startsWith("select version()")) {
                    singleValue(out, describe, "version", "PostgreSQL 15.0 (Bifrost gateway)");
                    return true;
                }
                if (lower.startsWith("select current_setting(")) {
                    singleValue(out, describe, "current_setting", "");
                    return true;
                }
                return false;
            }
        }
    }

    private static void complete(DataOutputStream out, PgOutput.Describe describe, String tag) throws IOException {
        if (describe.noData()) PgMessages.noData(out);
        PgMessages.commandComplete(out, tag);
    }

    private static void singleValue(DataOutputStream out, PgOutput.Describe describe, String column, String value)
            throws IOException {
        if (describe.rows()) PgMessages.rowDescription(out, new String[]{column});
        PgRowWriter.writeDataRow(out, new String[]{value});
        PgMessages.commandComplete(out, "SELECT 1");
    }

    /** Text-format parameter values, or null when any parameter is sent in binary. */
    private static List<String> readBindValues(ByteBuffer mb) {
        short formatCount = mb.getShort();
        boolean binary = false;
        short[] formats = new short[formatCount];
        for (int i = 0; i < formatCount; i++) {
            formats[i] = mb.getShort();
            binary |= formats[i] == 1;
        }
        short paramCount = mb.getShort();
        List<String> values = new ArrayList<>(paramCount);
        for (int i = 0; i < paramCount; i++) {
            int len = mb.getInt();
            if (len < 0) {
                values.add(null);
            } else {
                byte[] b = new byte[len];
                mb.get(b);
                values.add(new String(b, StandardCharsets.UTF_8));
            }
        }
        if (paramCount > 0 && binary) {
            return null;
        }
        return values;
    }

    private static ByteBuffer readStartup(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 8 || len > MAX_STARTUP_LENGTH) {
            throw new IOException("invalid startup packet length " + len);
        }
        return ByteBuffer.wrap(in.readNBytes(len - 4)).order(ByteOrder.BIG_ENDIAN);
    }

    private static Map<String, String> readStartupParams(ByteBuffer buf) {
        Map<String, String> params = new HashMap<>();
        while (buf.hasRemaining()) {
            String k = readCString(buf);
            if (k.isEmpty()) break;
            String v = readCString(buf);
            params.put(k, v);
        }
        return params;
    }

    /** {@code identity} startup parameter, or {@code -c identity=...} inside {@code options}. */
    static String identity(Map<String, String> params) {
        String direct = params.get("identity");
        if (direct != null && !direct.isBlank()) return direct;
        String options = params.get("options");
        if (options == null) return null;
        for (String part : options.split("\\s+")) {
            String p = part.startsWith("--") ? part.substring(2) : part;
            if (p.startsWith("identity=")) {
                return p.substring("identity=".length());
            }
        }
        return null;
    }

    private static String readCString(ByteBuffer buf) {
        int start = buf.position();
        while (buf.hasRemaining()) {
            if (buf.get() == 0) {
                int len = buf.position() - 1 - start;
                return new String(buf.array(), buf.arrayOffset() + start, len, StandardCharsets.UTF_8);
            }
        }
        // no terminator: take the rest
        return new String(buf.array(), buf.arrayOffset() + start, buf.position() - start, StandardCharsets.UTF_8);
    }

    private static String cstring(byte[] bytes, int offset) {
        int i = offset;
        while (i < bytes.length && bytes[i] != 0) i++;
        return new String(bytes, offset, i - offset, StandardCharsets.UTF_8);
    }
}
