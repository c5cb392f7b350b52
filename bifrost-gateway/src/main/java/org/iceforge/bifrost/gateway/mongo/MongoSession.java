package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.error.MalformedRequestException;
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
import java.io.UncheckedIOException;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One client connection on the MongoDB listener.
 *
 * <p>Clients authenticate with SASL PLAIN: the username is the proxy token, the password a
 * link password, and the optional authorization identity an identity token. Handshake and
 * session commands are answered locally; every other command needs a successful login and
 * goes through the proxy pipeline.
 */
final class MongoSession implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(MongoSession.class);

    private static final AtomicInteger CONNECTION_IDS = new AtomicInteger();
    private static final int MAX_WIRE_VERSION = 17;

    // Client session and transaction fields; the gateway keeps its own backend sessions.
    private static final Set<String> STRIPPED_FIELDS = Set.of(
            "lsid", "txnNumber", "autocommit", "startTransaction");

    private final Socket socket;
    private final ProxyPipeline pipeline;
    private final MongoBackend backend;
    private final MongoAdapter adapter;
    private final Duration idleTimeout;
    private final ClientContext client;
    private final int connectionId = CONNECTION_IDS.incrementAndGet();
    private final MongoSessions sessions = new MongoSessions();
    private final Map<Long, String> cursorOperations = new HashMap<>();

    private ClientCredentials credentials;

    MongoSession(Socket socket, ProxyPipeline pipeline, MongoBackend backend, MongoAdapter adapter,
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
        try (sessions;
             InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = new BufferedOutputStream(socket.getOutputStream())) {
            while (true) {
                MongoWire.Message m = MongoWire.read(in);
                switch (m.opCode()) {
                    case MongoWire.OP_QUERY -> {
                        MongoWire.Command cmd = MongoWire.decodeQuery(m);
                        MongoWire.writeReply(out, m.requestId(), dispatch(cmd));
                    }
                    case MongoWire.OP_MSG -> {
                        MongoWire.Command cmd = MongoWire.decodeMsg(m);
                        BsonDocument reply = dispatch(cmd);
                        if (!cmd.moreToCome()) {
                            MongoWire.writeMsg(out, m.requestId(), reply);
                        }
                    }
                    default -> {
                        log.debug("mongodb client {} sent unsupported opCode {}", client.remoteAddress(), m.opCode());
                        return;
                    }
                }
            }
        } catch (EOFException eof) {
            log.debug("mongodb client {} disconnected", client.remoteAddress());
        } catch (Exception e) {
            log.debug("mongodb session {} ended with error: {}", client.remoteAddress(), e.toString());
        }
    }

    BsonDocument dispatch(MongoWire.Command cmd) {
        BsonDocument doc = cmd.document();
        if (doc.isEmpty()) {
            return MongoErrors.failure(9, "FailedToParse", "empty command");
        }
        String name = doc.getFirstKey();
        switch (name.toLowerCase(Locale.ROOT)) {
            case "hello", "ismaster" -> {
                return hello(doc);
            }
            case "ping" -> {
                return ok();
            }
            case "buildinfo" -> {
                return ok().append("version", new BsonString("6.0.0"))
                        .append("versionArray", new BsonArray(List.of(
                                new BsonInt32(6), new BsonInt32(0), new BsonInt32(0), new BsonInt32(0))))
                        .append("maxBsonObjectSize", new BsonInt32(16 * 1024 * 1024));
            }
            case "saslstart" -> {
                return saslStart(doc);
            }
            case "saslcontinue" -> {
                return saslDone();
            }
            case "endsessions", "getlasterror" -> {
                return ok();
            }
            case "logout" -> {
                credentials = null;
                return ok();
            }
            default -> {
                return proxy(cmd.database(), doc, name);
            }
        }
    }

    private BsonDocument hello(BsonDocument request) {
        BsonDocument reply = new BsonDocument()
                .append("helloOk", BsonBoolean.TRUE)
                .append("isWritablePrimary", BsonBoolean.TRUE)
                .append("ismaster", BsonBoolean.TRUE)
                .append("maxBsonObjectSize", new BsonInt32(16 * 1024 * 1024))
                .append("maxMessageSizeBytes", new BsonInt32(MongoWire.MAX_MESSAGE_BYTES))
                .append("maxWriteBatchSize", new BsonInt32(100_000))
                .append("localTime", new BsonDateTime(System.currentTimeMillis()))
                .append("logicalSessionTimeoutMinutes", new BsonInt32(30))
                .append("connectionId", new BsonInt32(connectionId))
                .append("minWireVersion", new BsonInt32(0))
                .append("maxWireVersion", new BsonInt32(MAX_WIRE_VERSION))
                .append("readOnly", BsonBoolean.FALSE);
        if (request.containsKey("saslSupportedMechs")) {
            reply.append("saslSupportedMechs", new BsonArray(List.of(new BsonString("PLAIN"))));
        }
        return reply.append("ok", new BsonDouble(1));
    }

    /** PLAIN: {@code authzid \0 token \0 password}. */
    private BsonDocument saslStart(BsonDocument doc) {
        String mechanism = doc.containsKey("mechanism") ? doc.getString("mechanism").getValue() : "";
        if (!"PLAIN".equals(mechanism)) {
            return MongoErrors.failure(2, "BadValue", "only the PLAIN mechanism is supported");
        }
        BsonValue payload = doc.get("payload");
        if (payload == null || !payload.isBinary()) {
            return MongoErrors.failure(MongoErrors.AUTHENTICATION_FAILED, "AuthenticationFailed", "Authentication failed.");
        }
        String[] parts = new String(payload.asBinary().getData(), StandardCharsets.UTF_8).split("\0", -1);
        if (parts.length != 3) {
            return MongoErrors.failure(MongoErrors.AUTHENTICATION_FAILED, "AuthenticationFailed", "Authentication failed.");
        }
        ClientCredentials creds = new ClientCredentials(parts[1], parts[2].isEmpty() ? null : parts[2],
                parts[0].isEmpty() ? null : parts[0]);
        try {
            pipeline.authenticate(Protocol.MONGODB, creds, client);
        } catch (GatewayException e) {
            log.debug("mongodb login from {} rejected: {}", client.remoteAddress(), e.code());
            return MongoErrors.failure(MongoErrors.AUTHENTICATION_FAILED, "AuthenticationFailed", "Authentication failed.");
        }
        credentials = creds;
        try {
            socket.setSoTimeout((int) idleTimeout.toMillis());
        } catch (SocketException e) {
            log.debug("Could not set idle timeout for {}: {}", client.remoteAddress(), e.toString());
        }
        return saslDone();
    }

    private static BsonDocument saslDone() {
        return new BsonDocument("conversationId", new BsonInt32(1))
                .append("done", BsonBoolean.TRUE)
                .append("payload", new BsonBinary(new byte[0]))
                .append("ok", new BsonDouble(1));
    }

    private BsonDocument proxy(String database, BsonDocument doc, String name) {
        if (credentials == null) {
            pipeline.recordRejected(Protocol.MONGODB, name.toUpperCase(Locale.ROOT),
                    ErrorCode.AUTHENTICATION_REQUIRED, client);
            return MongoErrors.failure(MongoErrors.UNAUTHORIZED, "Unauthorized",
                    "command " + name + " requires authentication");
        }
        String operation = operation(doc, name);
        BsonDocument command = strip(doc);
        MongoOutput out = new MongoOutput();
        try {
            pipeline.handle(adapter, new MongoRequest(credentials, database, command, operation, sessions), client,
                    backend::run, out);
        } catch (MalformedRequestException e) {
            return MongoErrors.of(e.code());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        trackCursor(doc, name, out.reply, operation);
        return out.reply;
    }

    /** Cursor continuation is checked against the operation that opened the cursor. */
    String operation(BsonDocument doc, String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.equals("getmore")) {
            BsonValue id = doc.get(name);
            return id != null && id.isNumber() ? cursorOperations.getOrDefault(id.asNumber().longValue(), "FIND") : "FIND";
        }
        if (lower.equals("killcursors")) {
            List<Long> ids = cursorIds(doc.get("cursors"));
            return ids.isEmpty() ? "FIND" : cursorOperations.getOrDefault(ids.get(0), "FIND");
        }
        return MongoAdapter.commandOperation(name, doc);
    }

    /** Remembers cursors the backend opened and forgets them once killed or exhausted. */
    void trackCursor(BsonDocument doc, String name, BsonDocument reply, String operation) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.equals("killcursors")) {
            cursorIds(doc.get("cursors")).forEach(cursorOperations::remove);
            return;
        }
        long replyId = replyCursorId(reply);
        if (lower.equals("getmore")) {
            BsonValue requested = doc.get(name);
            if (replyId == 0 && requested != null && requested.isNumber()) {
                cursorOperations.remove(requested.asNumber().longValue());
            }
        } else if (replyId != 0) {
            cursorOperations.put(replyId, operation);
        }
    }

    int openCursors() {
        return cursorOperations.size();
    }

    private static long replyCursorId(BsonDocument reply) {
        if (reply == null) return 0;
        BsonValue cursor = reply.get("cursor");
        if (cursor == null || !cursor.isDocument()) return 0;
        BsonValue id = cursor.asDocument().get("id");
        return id != null && id.isNumber() ? id.asNumber().longValue() : 0;
    }

    private static List<Long> cursorIds(BsonValue ids) {
        List<Long> out = new ArrayList<>();
        if (ids != null && ids.isArray()) {
            for (BsonValue v : ids.asArray()) {
                if (v.isNumber()) out.add(v.asNumber().longValue());
            }
        }
        return out;
    }

    static BsonDocument strip(BsonDocument doc) {
        BsonDocument out = new BsonDocument();
        for (Map.Entry<String, BsonValue> e : doc.entrySet()) {
            String key = e.getKey();
            if (!key.startsWith("$") && !STRIPPED_FIELDS.contains(key)) {
                out.append(key, e.getValue());
            }
        }
        return out;
    }

    private static BsonDocument ok() {
        return new BsonDocument("ok", new BsonDouble(1));
    }
}
