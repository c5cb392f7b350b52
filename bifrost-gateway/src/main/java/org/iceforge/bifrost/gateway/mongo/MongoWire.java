package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonArray;
import org.bson.BsonBinaryWriter;
import org.bson.BsonDocument;
import org.bson.RawBsonDocument;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;
import org.iceforge.bifrost.error.MalformedRequestException;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MongoDB wire framing: little-endian 16-byte header, OP_QUERY/OP_REPLY for the legacy
 * handshake and OP_MSG for everything else.
 */
final class MongoWire {
    static final int OP_REPLY = 1;
    static final int OP_QUERY = 2004;
    static final int OP_COMPRESSED = 2012;
    static final int OP_MSG = 2013;

    static final int FLAG_CHECKSUM_PRESENT = 1;
    static final int FLAG_MORE_TO_COME = 1 << 1;

    static final int MAX_MESSAGE_BYTES = 48_000_000;

    private static final BsonDocumentCodec CODEC = new BsonDocumentCodec();
    private static final AtomicInteger REQUEST_IDS = new AtomicInteger();

    /** One received message. {@code body} is positioned after the header. */
    record Message(int requestId, int responseTo, int opCode, ByteBuffer body) {
    }

    /** A decoded command: OP_MSG body with document sequences folded in, or an OP_QUERY on {@code db.$cmd}. */
    record Command(String database, BsonDocument document, boolean moreToCome) {
    }

    private MongoWire() {
    }

    static Message read(InputStream in) throws IOException {
        byte[] header = in.readNBytes(16);
        if (header.length < 16) throw new EOFException();
        ByteBuffer h = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        int length = h.getInt();
        if (length < 16 || length > MAX_MESSAGE_BYTES) {
            throw new MalformedRequestException("invalid message length " + length);
        }
        int requestId = h.getInt();
        int responseTo = h.getInt();
        int opCode = h.getInt();
        byte[] body = in.readNBytes(length - 16);
        if (body.length < length - 16) throw new EOFException();
        return new Message(requestId, responseTo, opCode, ByteBuffer.wrap(body).order(ByteOrder.LITTLE_ENDIAN));
    }

    static Command decodeMsg(Message m) {
        ByteBuffer b = m.body();
        int flags = b.getInt();
        int end = b.limit() - ((flags & FLAG_CHECKSUM_PRESENT) != 0 ? 4 : 0);
        BsonDocument body = null;
        while (b.position() < end) {
            byte kind = b.get();
            if (kind == 0) {
                body = document(b);
            } else if (kind == 1) {
                int start = b.position();
                int size = b.getInt();
                String identifier = cstring(b);
                BsonArray docs = new BsonArray();
                while (b.position() < start + size) {
                    docs.add(document(b));
                }
                if (body == null) body = new BsonDocument();
                body.put(identifier, docs);
            } else {
                throw new MalformedRequestException("unknown OP_MSG section kind " + kind);
            }
        }
        if (body == null) throw new MalformedRequestException("OP_MSG without a body section");
        String db = body.containsKey("$db") ? body.getString("$db").getValue() : "admin";
        return new Command(db, body, (flags & FLAG_MORE_TO_COME) != 0);
    }

    static Command decodeQuery(Message m) {
        ByteBuffer b = m.body();
        b.getInt(); // flags
        String collection = cstring(b);
        b.getInt(); // numberToSkip
        b.getInt(); // numberToReturn
        BsonDocument query = document(b);
        int dot = collection.indexOf('.');
        String db = dot < 0 ? collection : collection.substring(0, dot);
        // Drivers wrap commands as {$query: {...}, $readPreference: ...} on mongos
        if (query.containsKey("$query") && query.get("$query").isDocument()) {
            query = query.getDocument("$query");
        }
        return new Command(db, query, false);
    }

    static void writeMsg(OutputStream out, int responseTo, BsonDocument reply) throws IOException {
        byte[] doc = encode(reply);
        ByteBuffer b = header(16 + 4 + 1 + doc.length, responseTo, OP_MSG);
        b.putInt(0).put((byte) 0).put(doc);
        out.write(b.array());
        out.flush();
    }

    static void writeReply(OutputStream out, int responseTo, BsonDocument reply) throws IOException {
        byte[] doc = encode(reply);
        ByteBuffer b = header(16 + 20 + doc.length, responseTo, OP_REPLY);
        b.putInt(0)     // responseFlags
                .putLong(0) // cursorID
                .putInt(0)  // startingFrom
                .putInt(1)  // numberReturned
                .put(doc);
        out.write(b.array());
        out.flush();
    }

    static byte[] encode(BsonDocument doc) {
        BasicOutputBuffer buffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
            CODEC.encode(writer, doc, EncoderContext.builder().build());
        }
        return buffer.toByteArray();
    }

    private static ByteBuffer header(int length, int responseTo, int opCode) {
        return ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(length)
                .putInt(REQUEST_IDS.incrementAndGet())
                .putInt(responseTo)
                .putInt(opCode);
    }

    private static BsonDocument document(ByteBuffer b) {
        if (b.remaining() < 5) throw new MalformedRequestException("truncated BSON document");
        int size = b.getInt(b.position());
        if (size < 5 || size > b.remaining()) throw new MalformedRequestException("invalid BSON document size");
        byte[] bytes = new byte[size];
        b.get(bytes);
        return new RawBsonDocument(bytes).decode(CODEC);
    }

    private static String cstring(ByteBuffer b) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (b.hasRemaining()) {
            byte c = b.get();
            if (c == 0) break;
            out.write(c);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
