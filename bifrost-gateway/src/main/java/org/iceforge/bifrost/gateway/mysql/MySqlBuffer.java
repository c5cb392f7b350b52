package org.iceforge.bifrost.gateway.mysql;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/** Little-endian payload builder with MySQL length-encoded integers and strings. */
final class MySqlBuffer {
    private final ByteArrayOutputStream buf = new ByteArrayOutputStream(64);

    MySqlBuffer int1(int v) {
        buf.write(v & 0xFF);
        return this;
    }

    MySqlBuffer int2(int v) {
        buf.write(v & 0xFF);
        buf.write((v >> 8) & 0xFF);
        return this;
    }

    MySqlBuffer int3(int v) {
        int2(v);
        buf.write((v >> 16) & 0xFF);
        return this;
    }

    MySqlBuffer int4(long v) {
        int2((int) v);
        int2((int) (v >> 16));
        return this;
    }

    MySqlBuffer int8(long v) {
        int4(v);
        int4(v >> 32);
        return this;
    }

    MySqlBuffer lenenc(long v) {
        if (v < 251) {
            int1((int) v);
        } else if (v < (1 << 16)) {
            int1(0xFC).int2((int) v);
        } else if (v < (1 << 24)) {
            int1(0xFD).int3((int) v);
        } else {
            int1(0xFE).int8(v);
        }
        return this;
    }

    MySqlBuffer lenencString(String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        lenenc(b.length);
        buf.writeBytes(b);
        return this;
    }

    MySqlBuffer cstring(String s) {
        buf.writeBytes(s.getBytes(StandardCharsets.UTF_8));
        buf.write(0);
        return this;
    }

    MySqlBuffer bytes(byte[] b) {
        buf.writeBytes(b);
        return this;
    }

    MySqlBuffer string(String s) {
        return bytes(s.getBytes(StandardCharsets.UTF_8));
    }

    MySqlBuffer zeros(int n) {
        for (int i = 0; i < n; i++) buf.write(0);
        return this;
    }

    byte[] toByteArray() {
        return buf.toByteArray();
    }
}
