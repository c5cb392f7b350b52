package org.iceforge.bifrost.gateway.pgwire;

import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * DataRow encoding, text format only.
 */
final class PgRowWriter {
    private PgRowWriter() {}

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    private static final DateTimeFormatter TIMESTAMPTZ = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSxxx");

    /** Writes one DataRow and returns its size on the wire. */
    static int writeDataRow(DataOutputStream out, String[] values) throws IOException {
        int size = 2;
        byte[][] encoded = new byte[values.length][];
        for (int i = 0; i < values.length; i++) {
            String v = values[i];
            if (v == null) {
                size += 4;
            } else {
                byte[] b = v.getBytes(StandardCharsets.UTF_8);
                encoded[i] = b;
                size += 4 + b.length;
            }
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
        b.putShort((short) values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                b.putInt(-1);
            } else {
                byte[] bytes = encoded[i];
                b.putInt(bytes.length);
                b.put(bytes);
            }
        }

        out.writeByte('D');
        out.writeInt(4 + b.position());
        out.write(b.array(), 0, b.position());
        return 5 + b.position();
    }

    /** PostgreSQL text representation of a JDBC value. */
    static String text(Object v) {
        if (v == null) return null;
        if (v instanceof Boolean bool) return bool ? "t" : "f";
        if (v instanceof byte[] bytes) return "\\x" + HexFormat.of().formatHex(bytes);
        if (v instanceof OffsetDateTime odt) return TIMESTAMPTZ.format(odt);
        if (v instanceof LocalDateTime ldt) return TIMESTAMP.format(ldt);
        return v.toString();
    }
}
