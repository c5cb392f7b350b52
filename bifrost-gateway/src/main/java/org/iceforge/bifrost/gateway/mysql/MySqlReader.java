package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.error.MalformedRequestException;

import java.nio.charset.StandardCharsets;

/** Cursor over a received payload. Reading past the end is a malformed packet. */
final class MySqlReader {
    private final byte[] b;
    private int pos;

    MySqlReader(byte[] payload) {
        this.b = payload;
    }

    boolean hasRemaining() {
        return pos < b.length;
    }

    int position() {
        return pos;
    }

    int int1() {
        need(1);
        return b[pos++] & 0xFF;
    }

    int int2() {
        return int1() | (int1() << 8);
    }

    long int4() {
        return (int2() & 0xFFFFL) | ((long) int2() << 16);
    }

    long lenenc() {
        int first = int1();
        return switch (first) {
            case 0xFC -> int2();
            case 0xFD -> int2() | ((long) int1() << 16);
            case 0xFE -> int4() | (int4() << 32);
            default -> first;
        };
    }

    byte[] bytes(int n) {
        need(n);
        byte[] out = new byte[n];
        System.arraycopy(b, pos, out, 0, n);
        pos += n;
        return out;
    }

    void skip(int n) {
        need(n);
        pos += n;
    }

    String cstring() {
        int start = pos;
        while (pos < b.length && b[pos] != 0) pos++;
        String s = new String(b, start, pos - start, StandardCharsets.UTF_8);
        if (pos < b.length) pos++;
        return s;
    }

    String lenencString() {
        long len = lenenc();
        if (len > b.length - pos) throw new MalformedRequestException("length-encoded string overruns packet");
        return new String(bytes((int) len), StandardCharsets.UTF_8);
    }

    String rest() {
        String s = new String(b, pos, b.length - pos, StandardCharsets.UTF_8);
        pos = b.length;
        return s;
    }

    private void need(int n) {
        if (n < 0 || pos + n > b.length) {
            throw new MalformedRequestException("truncated packet");
        }
    }
}
