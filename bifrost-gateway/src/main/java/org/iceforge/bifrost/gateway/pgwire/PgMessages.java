package org.iceforge.bifrost.gateway.pgwire;

import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;

/** Backend message writers of protocol 3.0. */
final class PgMessages {
    private PgMessages() {}

    static void authOk(DataOutputStream out) throws IOException {
        out.writeByte('R');
        out.writeInt(8);
        out.writeInt(0);
    }

    static void authCleartext(DataOutputStream out) throws IOException {
        out.writeByte('R');
        out.writeInt(8);
        out.writeInt(3);
    }

    static void parameterStatus(DataOutputStream out, String key, String value) throws IOException {
        byte[] k = (key + "\0").getBytes(StandardCharsets.UTF_8);
        byte[] v = (value + "\0").getBytes(StandardCharsets.UTF_8);
        out.writeByte('S');
        out.writeInt(4 + k.length + v.length);
        out.write(k);
        out.write(v);
    }

    static void backendKeyData(DataOutputStream out, int pid, int secretKey) throws IOException {
        out.writeByte('K');
        out.writeInt(12);
        out.writeInt(pid);
        out.writeInt(secretKey);
    }

    static void ready(DataOutputStream out) throws IOException {
        out.writeByte('Z');
        out.writeInt(5);
        out.writeByte('I'); // idle
    }

    static void emptyQueryResponse(DataOutputStream out) throws IOException {
        out.writeByte('I');
        out.writeInt(4);
    }

    static void parseComplete(DataOutputStream out) throws IOException {
        out.writeByte('1');
        out.writeInt(4);
    }

    static void bindComplete(DataOutputStream out) throws IOException {
        out.writeByte('2');
        out.writeInt(4);
    }

    static void closeComplete(DataOutputStream out) throws IOException {
        out.writeByte('3');
        out.writeInt(4);
    }

    static void noData(DataOutputStream out) throws IOException {
        out.writeByte('n');
        out.writeInt(4);
    }

    static void commandComplete(DataOutputStream out, String tag) throws IOException {
        byte[] t = (tag + "\0").getBytes(StandardCharsets.UTF_8);
        out.writeByte('C');
        out.writeInt(4 + t.length);
        out.write(t);
    }

    static void parameterDescription(DataOutputStream out, int count) throws IOException {
        out.writeByte('t');
        out.writeInt(4 + 2 + 4 * count);
        out.writeShort(count);
        for (int i = 0; i < count; i++) {
            out.writeInt(PgType.TEXT);
        }
    }

    /** All-text row description for locally answered statements. */
    static void rowDescription(DataOutputStream out, String[] columns) throws IOException {
        ByteBuffer b = ByteBuffer.allocate(64 + columns.length * 64).order(ByteOrder.BIG_ENDIAN);
        b.putShort((short) columns.length);
        for (String col : columns) {
            b = ensure(b, 64 + col.length() * 4);
            putCString(b, col);
            b.putInt(0); // table oid
            b.putShort((short) 0); // attr #
            b.putInt(PgType.TEXT);
            b.putShort((short) -1); // size
            b.putInt(0); // type modifier
            b.putShort((short) 0); // format code 0=text
        }
        int msgLen = b.position();
        out.writeByte('T');
        out.writeInt(4 + msgLen);
        out.write(b.array(), 0, msgLen);
    }

    static void rowDescription(DataOutputStream out, ResultSetMetaData md) throws IOException {
        try {
            int fieldCount = md.getColumnCount();
            ByteBuffer b = ByteBuffer.allocate(4096).order(ByteOrder.BIG_ENDIAN);
            b.putShort((short) fieldCount);
            for (int i = 1; i <= fieldCount; i++) {
                String col = md.getColumnLabel(i);
                col = col == null ? ("col_" + i) : col;
                b = ensure(b, 64 + col.length() * 4);
                putCString(b, col);
                b.putInt(0); // table oid
                b.putShort((short) 0); // attr #

                int oid = JdbcToPgTypeMapper.toPgOid(md, i);
                b.putInt(oid);
                b.putShort((short) -1); // size (variable)

                int typmod = oid == PgType.NUMERIC
                        ? JdbcToPgTypeMapper.numericTypmod(md.getPrecision(i), md.getScale(i))
                        : 0;
                b.putInt(typmod);
                b.putShort((short) 0); // format code 0=text
            }

            int msgLen = b.position();
            out.writeByte('T');
            out.writeInt(4 + msgLen);
            out.write(b.array(), 0, msgLen);
        } catch (SQLException e) {
            throw new IOException("Failed to write RowDescription", e);
        }
    }

    static void error(DataOutputStream out, String severity, String sqlState, String message) throws IOException {
        byte[] sev = (severity + "\0").getBytes(StandardCharsets.UTF_8);
        byte[] code = (sqlState + "\0").getBytes(StandardCharsets.UTF_8);
        byte[] msg = ((message == null ? "" : message) + "\0").getBytes(StandardCharsets.UTF_8);

        int payloadLen = 1 + sev.length + 1 + sev.length + 1 + code.length + 1 + msg.length + 1;
        out.writeByte('E');
        out.writeInt(4 + payloadLen);
        out.writeByte('S');
        out.write(sev);
        out.writeByte('V');
        out.write(sev);
        out.writeByte('C');
        out.write(code);
        out.writeByte('M');
        out.write(msg);
        out.writeByte(0);
    }

    private static ByteBuffer ensure(ByteBuffer b, int needed) {
        if (b.remaining() >= needed) return b;
        ByteBuffer nb = ByteBuffer.allocate(Math.max(b.capacity() * 2, b.position() + needed)).order(ByteOrder.BIG_ENDIAN);
        b.flip();
        nb.put(b);
        return nb;
    }

    private static void putCString(ByteBuffer b, String s) {
        b.put(s.getBytes(StandardCharsets.UTF_8));
        b.put((byte) 0);
    }
}
