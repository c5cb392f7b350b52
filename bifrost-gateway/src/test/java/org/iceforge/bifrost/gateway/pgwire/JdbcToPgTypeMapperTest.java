package org.iceforge.bifrost.gateway.pgwire;

import org.junit.jupiter.api.Test;

import java.sql.Types;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JdbcToPgTypeMapperTest {

    @Test
    void mapsCommonJdbcTypes() {
        assertEquals(PgType.INT8, JdbcToPgTypeMapper.toPgOid(Types.BIGINT));
        assertEquals(PgType.INT4, JdbcToPgTypeMapper.toPgOid(Types.INTEGER));
        assertEquals(PgType.INT2, JdbcToPgTypeMapper.toPgOid(Types.TINYINT));
        assertEquals(PgType.NUMERIC, JdbcToPgTypeMapper.toPgOid(Types.DECIMAL));
        assertEquals(PgType.FLOAT8, JdbcToPgTypeMapper.toPgOid(Types.DOUBLE));
        assertEquals(PgType.BOOL, JdbcToPgTypeMapper.toPgOid(Types.BIT));
        assertEquals(PgType.VARCHAR, JdbcToPgTypeMapper.toPgOid(Types.VARCHAR));
        assertEquals(PgType.BYTEA, JdbcToPgTypeMapper.toPgOid(Types.VARBINARY));
        assertEquals(PgType.DATE, JdbcToPgTypeMapper.toPgOid(Types.DATE));
    }

    @Test
    void timestampWithoutZoneStaysPlain() {
        assertEquals(PgType.TIMESTAMP, JdbcToPgTypeMapper.toPgOid(Types.TIMESTAMP));
        assertEquals(PgType.TIMESTAMPTZ, JdbcToPgTypeMapper.toPgOid(Types.TIMESTAMP_WITH_TIMEZONE));
    }

    @Test
    void unknownTypesFallBackToText() {
        assertEquals(PgType.TEXT, JdbcToPgTypeMapper.toPgOid(Types.OTHER));
        assertEquals(PgType.TEXT, JdbcToPgTypeMapper.toPgOid(Types.ARRAY));
    }

    @Test
    void numericTypmod() {
        assertEquals(((10 << 16) | 2) + 4, JdbcToPgTypeMapper.numericTypmod(10, 2));
        assertEquals(0, JdbcToPgTypeMapper.numericTypmod(0, 0));
    }
}
