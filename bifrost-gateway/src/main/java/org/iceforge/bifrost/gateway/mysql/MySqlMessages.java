package org.iceforge.bifrost.gateway.mysql;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Arrays;

/** Server-side packets of the MySQL 4.1 text protocol. */
final class MySqlMessages {
    static final String SERVER_VERSION = "8.0.34-bifrost";
    static final String NATIVE_PASSWORD = "mysql_native_password";
    static final String CLEAR_PASSWORD = "mysql_clear_password";

    static final int CLIENT_LONG_PASSWORD = 0x00000001;
    static final int CLIENT_FOUND_ROWS = 0x00000002;
    static final int CLIENT_LONG_FLAG = 0x00000004;
    static final int CLIENT_CONNECT_WITH_DB = 0x00000008;
    static final int CLIENT_PROTOCOL_41 = 0x00000200;
    static final int CLIENT_TRANSACTIONS = 0x00002000;
    static final int CLIENT_SECURE_CONNECTION = 0x00008000;
    static final int CLIENT_MULTI_RESULTS = 0x00020000;
    static final int CLIENT_PLUGIN_AUTH = 0x00080000;
    static final int CLIENT_CONNECT_ATTRS = 0x00100000;
    static final int CLIENT_PLUGIN_AUTH_LENENC = 0x00200000;

    static final int SERVER_CAPABILITIES = CLIENT_LONG_PASSWORD | CLIENT_FOUND_ROWS | CLIENT_LONG_FLAG
            | CLIENT_CONNECT_WITH_DB | CLIENT_PROTOCOL_41 | CLIENT_TRANSACTIONS | CLIENT_SECURE_CONNECTION
            | CLIENT_MULTI_RESULTS | CLIENT_PLUGIN_AUTH | CLIENT_CONNECT_ATTRS | CLIENT_PLUGIN_AUTH_LENENC;

    static final int SERVER_STATUS_AUTOCOMMIT = 0x0002;

    // utf8mb4_general_ci and binary
    static final int CHARSET_UTF8MB4 = 45;
    static final int CHARSET_BINARY = 63;

    private MySqlMessages() {
    }

    /** HandshakeV10. {@code scramble} must be 20 bytes. */
    static void handshake(MySqlPacketIO io, int connectionId, byte[] scramble) throws IOException {
        MySqlBuffer b = new MySqlBuffer()
                .int1(10)
                .cstring(SERVER_VERSION)
                .int4(connectionId)
                .bytes(Arrays.copyOfRange(scramble, 0, 8))
                .int1(0)
                .int2(SERVER_CAPABILITIES & 0xFFFF)
                .int1(CHARSET_UTF8MB4)
                .int2(SERVER_STATUS_AUTOCOMMIT)
                .int2((SERVER_CAPABILITIES >>> 16) & 0xFFFF)
                .int1(21)
                .zeros(10)
                .bytes(Arrays.copyOfRange(scramble, 8, 20))
                .int1(0)
                .cstring(NATIVE_PASSWORD);
        io.write(b.toByteArray());
        io.flush();
    }

    /** Asks the client to resend its password in clear text. */
    static void authSwitch(MySqlPacketIO io, String plugin) throws IOException {
        io.write(new MySqlBuffer().int1(0xFE).cstring(plugin).toByteArray());
        io.flush();
    }

    static int ok(MySqlPacketIO io, long affectedRows) throws IOException {
        return io.write(new MySqlBuffer()
                .int1(0x00)
                .lenenc(Math.max(affectedRows, 0))
                .lenenc(0)
                .int2(SERVER_STATUS_AUTOCOMMIT)
                .int2(0)
                .toByteArray());
    }

    static void error(MySqlPacketIO io, int errno, String sqlState, String message) throws IOException {
        String state = sqlState == null || sqlState.length() != 5 ? "HY000" : sqlState;
        io.write(new MySqlBuffer()
                .int1(0xFF)
                .int2(errno)
                .string("#")
                .string(state)
                .string(message == null ? "" : message)
                .toByteArray());
    }

    static int eof(MySqlPacketIO io) throws IOException {
        return io.write(new MySqlBuffer().int1(0xFE).int2(0).int2(SERVER_STATUS_AUTOCOMMIT).toByteArray());
    }

    static int columnCount(MySqlPacketIO io, int count) throws IOException {
        return io.write(new MySqlBuffer().lenenc(count).toByteArray());
    }

    static int column(MySqlPacketIO io, String schema, String table, String name, int type, int charset,
                      long length, int decimals) throws IOException {
        return io.write(new MySqlBuffer()
                .lenencString("def")
                .lenencString(schema)
                .lenencString(table)
                .lenencString(table)
                .lenencString(name)
                .lenencString(name)
                .lenenc(0x0C)
                .int2(charset)
                .int4(length)
                .int1(type)
                .int2(0)
                .int1(decimals)
                .int2(0)
                .toByteArray());
    }

    /** Column definitions and the closing EOF for a JDBC result. */
    static int columns(MySqlPacketIO io, ResultSetMetaData md) throws IOException, SQLException {
        int n = md.getColumnCount();
        int bytes = columnCount(io, n);
        for (int i = 1; i <= n; i++) {
            int type = MySqlTypes.fieldType(md.getColumnType(i));
            bytes += column(io,
                    nullToEmpty(md.getSchemaName(i)),
                    nullToEmpty(md.getTableName(i)),
                    md.getColumnLabel(i),
                    type,
                    MySqlTypes.isBinary(type) ? CHARSET_BINARY : CHARSET_UTF8MB4,
                    Math.max(md.getColumnDisplaySize(i), 0),
                    Math.max(md.getScale(i), 0));
        }
        return bytes + eof(io);
    }

    /** Text row: each value length-encoded, SQL NULL as 0xFB. */
    static int row(MySqlPacketIO io, byte[][] values) throws IOException {
        MySqlBuffer b = new MySqlBuffer();
        for (byte[] v : values) {
            if (v == null) {
                b.int1(0xFB);
            } else {
                b.lenenc(v.length).bytes(v);
            }
        }
        return io.write(b.toByteArray());
    }

    /** A resultset of string columns, used for locally answered statements. */
    static void textResult(MySqlPacketIO io, String[] columns, String[] values) throws IOException {
        columnCount(io, columns.length);
        for (String c : columns) {
            column(io, "", "", c, MySqlTypes.VAR_STRING, CHARSET_UTF8MB4, 256, 0);
        }
        eof(io);
        if (values != null) {
            byte[][] row = new byte[values.length][];
            for (int i = 0; i < values.length; i++) {
                row[i] = values[i] == null ? null : values[i].getBytes(StandardCharsets.UTF_8);
            }
            row(io, row);
        }
        eof(io);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
