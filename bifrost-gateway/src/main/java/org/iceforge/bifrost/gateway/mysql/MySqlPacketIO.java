package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.error.MalformedRequestException;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * MySQL packet framing: 3-byte little-endian length, 1-byte sequence id, payload.
 *
 * <p>Replies continue the sequence of the packet last read.
 */
final class MySqlPacketIO {
    static final int MAX_PAYLOAD = 0xFFFFFF;
    /** MySQL's default {@code max_allowed_packet}. */
    static final int MAX_REQUEST_BYTES = 64 * 1024 * 1024;
    /** Handshake responses and auth-switch replies are small. */
    static final int HANDSHAKE_REQUEST_BYTES = 64 * 1024;

    private final InputStream in;
    private final OutputStream out;
    private int sequence;
    private int limit = MAX_REQUEST_BYTES;

    MySqlPacketIO(InputStream in, OutputStream out) {
        this.in = in;
        this.out = out;
    }

    /** Largest request payload {@link #read()} accepts, continuation packets included. */
    void limit(int maxBytes) {
        this.limit = maxBytes;
    }

    /**
     * Reads one request, joining continuation packets.
     *
     * @throws MalformedRequestException when the payload would exceed the limit; nothing beyond
     *         the offending header has been read
     */
    byte[] read() throws IOException {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        int len;
        do {
            byte[] header = in.readNBytes(4);
            if (header.length < 4) throw new EOFException();
            len = (header[0] & 0xFF) | ((header[1] & 0xFF) << 8) | ((header[2] & 0xFF) << 16);
            if ((long) payload.size() + len > limit) {
                throw new MalformedRequestException("request exceeds " + limit + " bytes");
            }
            sequence = (header[3] & 0xFF) + 1;
            byte[] chunk = in.readNBytes(len);
            if (chunk.length < len) throw new EOFException();
            payload.write(chunk);
        } while (len == MAX_PAYLOAD);
        return payload.toByteArray();
    }

    /** Writes one packet, splitting payloads of 16 MiB and more. Returns bytes written. */
    int write(byte[] payload) throws IOException {
        int offset = 0;
        int written = 0;
        while (true) {
            int len = Math.min(MAX_PAYLOAD, payload.length - offset);
            out.write(len & 0xFF);
            out.write((len >> 8) & 0xFF);
            out.write((len >> 16) & 0xFF);
            out.write(sequence & 0xFF);
            sequence++;
            out.write(payload, offset, len);
            written += 4 + len;
            offset += len;
            if (len < MAX_PAYLOAD) return written;
        }
    }

    void flush() throws IOException {
        out.flush();
    }

    void resetSequence() {
        sequence = 0;
    }
}
