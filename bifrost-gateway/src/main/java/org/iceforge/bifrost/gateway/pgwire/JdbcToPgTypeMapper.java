package org.iceforge.bifrost.gateway.pgwire;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;

/** Maps backend JDBC column types to PostgreSQL type OIDs for RowDescription. */
final class JdbcToPgTypeMapper {
    private JdbcToPgTypeMapper() {}

    static int toPgOid(ResultSetMetaData md, int columnIndex) throws SQLException {
        return toPgOid(md.getColumnType(columnIndex));
    }

    static int toPgOid(int jdbcType) {
        return switch (jdbcType) {
            case Types.BIGINT -> PgType.INT8;
            case Types.INTEGER -> PgType.INT4;
            case Types.SMALLINT, Types.TINYINT -> PgType.INT2;

            case Types.DECIMAL, Types.NUMERIC -> PgType.NUMERIC;

            case Types.DOUBLE -> PgType.FLOAT8;
            case Types.FLOAT, Types.REAL -> PgType.FLOAT4;

            case Types.BOOLEAN, Types.BIT -> PgType.BOOL;

            case Types.VARCHAR, Types.NVARCHAR, Types.LONGVARCHAR, Types.LONGNVARCHAR, Types.CHAR, Types.NCHAR -> PgType.VARCHAR;
            case Types.CLOB, Types.NCLOB -> PgType.TEXT;

            case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> PgType.BYTEA;

            case Types.DATE -> PgType.DATE;
            case Types.TIME, Types.TIME_WITH_TIMEZONE -> PgType.TIME;

            // timestamptz only when the backend says so; everything else is a plain timestamp.
            case Types.TIMESTAMP_WITH_TIMEZONE -> PgType.TIMESTAMPTZ;
            case Types.TIMESTAMP -> PgType.TIMESTAMP;

            // TEXT parses everywhere; UNKNOWN makes some drivers refuse the column.
            default -> PgType.TEXT;
        };
    }

    /** PostgreSQL type modifier for NUMERIC columns: ((precision << 16) | scale) + 4. */
    static int numericTypmod(int precision, int scale) {
        if (precision <= 0) return 0;
        return (((precision & 0xFFFF) << 16) | (scale & 0xFFFF)) + 4;
    }
}
