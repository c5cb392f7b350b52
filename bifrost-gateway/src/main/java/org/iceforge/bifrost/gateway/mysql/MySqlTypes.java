package org.iceforge.bifrost.gateway.mysql;

import java.sql.Types;

/** JDBC type to MySQL column type, for column definitions. */
final class MySqlTypes {
    static final int DECIMAL = 0x00;
    static final int TINY = 0x01;
    static final int SHORT = 0x02;
    static final int LONG = 0x03;
    static final int FLOAT = 0x04;
    static final int DOUBLE = 0x05;
    static final int NULL = 0x06;
    static final int TIMESTAMP = 0x07;
    static final int LONGLONG = 0x08;
    static final int DATE = 0x0A;
    static final int TIME = 0x0B;
    static final int DATETIME = 0x0C;
    static final int NEWDECIMAL = 0xF6;
    static final int BLOB = 0xFC;
    static final int VAR_STRING = 0xFD;

    private MySqlTypes() {
    }

    static int fieldType(int jdbcType) {
        return switch (jdbcType) {
            case Types.BIT, Types.BOOLEAN, Types.TINYINT -> TINY;
            case Types.SMALLINT -> SHORT;
            case Types.INTEGER -> LONG;
            case Types.BIGINT -> LONGLONG;
            case Types.REAL -> FLOAT;
            case Types.FLOAT, Types.DOUBLE -> DOUBLE;
            case Types.NUMERIC, Types.DECIMAL -> NEWDECIMAL;
            case Types.DATE -> DATE;
            case Types.TIME, Types.TIME_WITH_TIMEZONE -> TIME;
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> DATETIME;
            case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> BLOB;
            case Types.NULL -> NULL;
            default -> VAR_STRING;
        };
    }

    static boolean isBinary(int fieldType) {
        return fieldType == BLOB;
    }
}
