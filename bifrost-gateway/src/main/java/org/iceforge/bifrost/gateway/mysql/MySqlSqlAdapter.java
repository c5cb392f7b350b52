package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.jdbc.JdbcResult;
import org.iceforge.bifrost.gateway.jdbc.SqlVerbs;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProtocolAdapter;
import org.iceforge.bifrost.token.ClientCredentials;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;

/** Frames relational backend results as MySQL text-protocol resultsets. */
final class MySqlSqlAdapter implements ProtocolAdapter<MySqlQuery, JdbcResult, MySqlOutput> {

    private static final int FLUSH_EVERY = 256;

    private final long maxResponseBytes;

    MySqlSqlAdapter(long maxResponseBytes) {
        this.maxResponseBytes = maxResponseBytes;
    }

    @Override
    public Protocol protocol() {
        return Protocol.MYSQL;
    }

    @Override
    public ClientCredentials parseToken(MySqlQuery request) {
        return request.credentials();
    }

    @Override
    public String parseOperation(MySqlQuery request) {
        return SqlVerbs.operation(request.sql());
    }

    @Override
    public boolean isReadOnly(String operation) {
        return SqlVerbs.isReadOnly(operation);
    }

    @Override
    public long frameResponse(JdbcResult result, MySqlOutput out) throws IOException {
        if (result.isError()) {
            backendError(result.error(), out);
            return 0;
        }
        if (!result.hasRows()) {
            MySqlMessages.ok(out.io, result.updateCount());
            return 0;
        }
        try {
            ResultSet rs = result.resultSet();
            ResultSetMetaData md = rs.getMetaData();
            MySqlMessages.columns(out.io, md);
            int colCount = md.getColumnCount();
            long rows = 0;
            long bytes = 0;
            while (rs.next()) {
                byte[][] row = new byte[colCount][];
                for (int i = 1; i <= colCount; i++) {
                    row[i - 1] = value(rs.getObject(i));
                }
                bytes += MySqlMessages.row(out.io, row);
                rows++;
                if (bytes > maxResponseBytes) {
                    frameError(new GatewayException(ErrorCode.RESPONSE_TOO_LARGE,
                            "result exceeds " + maxResponseBytes + " bytes"), out);
                    return bytes;
                }
                if (rows % FLUSH_EVERY == 0) {
                    out.io.flush();
                }
            }
            result.markConsumed();
            MySqlMessages.eof(out.io);
            return bytes;
        } catch (SQLException e) {
            backendError(e, out);
            return 0;
        }
    }

    @Override
    public void frameError(GatewayException error, MySqlOutput out) throws IOException {
        MySqlErrors.Native n = MySqlErrors.of(error.code());
        MySqlMessages.error(out.io, n.errno(), n.sqlState(), error.code().publicMessage());
    }

    private static void backendError(SQLException e, MySqlOutput out) throws IOException {
        int errno = e.getErrorCode() > 0 ? e.getErrorCode() : MySqlErrors.ER_UNKNOWN;
        MySqlMessages.error(out.io, errno, e.getSQLState(), e.getMessage());
    }

    static byte[] value(Object v) {
        if (v == null) return null;
        if (v instanceof byte[] b) return b;
        if (v instanceof Boolean bool) return (bool ? "1" : "0").getBytes(StandardCharsets.US_ASCII);
        if (v instanceof Timestamp ts) {
            return ts.toLocalDateTime().toString().replace('T', ' ').getBytes(StandardCharsets.US_ASCII);
        }
        if (v instanceof LocalDateTime ldt) {
            return ldt.toString().replace('T', ' ').getBytes(StandardCharsets.US_ASCII);
        }
        return v.toString().getBytes(StandardCharsets.UTF_8);
    }
}
