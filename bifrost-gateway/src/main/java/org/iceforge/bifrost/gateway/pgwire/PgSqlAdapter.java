package org.iceforge.bifrost.gateway.pgwire;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.jdbc.JdbcResult;
import org.iceforge.bifrost.gateway.jdbc.SqlVerbs;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProtocolAdapter;
import org.iceforge.bifrost.token.ClientCredentials;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;

/** Frames relational backend results as PostgreSQL protocol messages. */
final class PgSqlAdapter implements ProtocolAdapter<PgQuery, JdbcResult, PgOutput> {

    // Flush every N rows so large results are not buffered in memory.
    private static final int FLUSH_EVERY = 256;

    private final long maxResponseBytes;

    PgSqlAdapter(long maxResponseBytes) {
        this.maxResponseBytes = maxResponseBytes;
    }

    @Override
    public Protocol protocol() {
        return Protocol.POSTGRESQL;
    }

    @Override
    public ClientCredentials parseToken(PgQuery request) {
        return request.credentials();
    }

    @Override
    public String parseOperation(PgQuery request) {
        return SqlVerbs.operation(request.sql());
    }

    @Override
    public boolean isReadOnly(String operation) {
        return SqlVerbs.isReadOnly(operation);
    }

    @Override
    public long frameResponse(JdbcResult result, PgOutput out) throws IOException {
        if (result.isError()) {
            SQLException e = result.error();
            PgMessages.error(out.stream, "ERROR", e.getSQLState() == null ? "XX000" : e.getSQLState(), e.getMessage());
            out.errorSent = true;
            return 0;
        }
        if (!result.hasRows()) {
            if (out.describe.noData()) PgMessages.noData(out.stream);
            PgMessages.commandComplete(out.stream, commandTag(out.verb, result.updateCount()));
            return 0;
        }

        try {
            ResultSet rs = result.resultSet();
            ResultSetMetaData md = rs.getMetaData();
            if (out.describe.rows()) PgMessages.rowDescription(out.stream, md);

            int colCount = md.getColumnCount();
            long rows = 0;
            long bytes = 0;
            while (rs.next()) {
                String[] row = new String[colCount];
                for (int i = 1; i <= colCount; i++) {
                    row[i - 1] = PgRowWriter.text(rs.getObject(i));
                }
                bytes += PgRowWriter.writeDataRow(out.stream, row);
                rows++;
                if (bytes > maxResponseBytes) {
                    frameError(new GatewayException(ErrorCode.RESPONSE_TOO_LARGE,
                            "result exceeds " + maxResponseBytes + " bytes"), out);
                    return bytes;
                }
                if (rows % FLUSH_EVERY == 0) {
                    out.stream.flush();
                }
            }
            result.markConsumed();
            PgMessages.commandComplete(out.stream, "SELECT " + rows);
            return bytes;
        } catch (SQLException e) {
            PgMessages.error(out.stream, "ERROR", e.getSQLState() == null ? "XX000" : e.getSQLState(), e.getMessage());
            out.errorSent = true;
            return 0;
        }
    }

    @Override
    public void frameError(GatewayException error, PgOutput out) throws IOException {
        PgMessages.error(out.stream, "ERROR", PgErrors.sqlState(error.code()), error.code().publicMessage());
        out.errorSent = true;
    }

    static String commandTag(String verb, long count) {
        long n = Math.max(count, 0);
        return switch (verb) {
            case "INSERT" -> "INSERT 0 " + n;
            case "UPDATE", "DELETE", "MERGE", "SELECT", "COPY" -> verb + " " + n;
            case "" -> "OK";
            default -> verb;
        };
    }
}
