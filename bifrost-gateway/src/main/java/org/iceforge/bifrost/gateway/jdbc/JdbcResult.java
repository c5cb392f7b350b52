package org.iceforge.bifrost.gateway.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Outcome of one statement on a relational backend: an open result set to stream, an
 * update count, or an error the backend reported for the statement.
 *
 * <p>Holds the pooled connection until closed. Closing before {@link #markConsumed()} cancels
 * the statement on the backend.
 */
public final class JdbcResult implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcResult.class);

    private final Connection connection;
    private final Statement statement;
    private final ResultSet resultSet;
    private final long updateCount;
    private final SQLException error;
    private volatile boolean consumed;

    private JdbcResult(Connection connection, Statement statement, ResultSet resultSet, long updateCount,
                       SQLException error) {
        this.connection = connection;
        this.statement = statement;
        this.resultSet = resultSet;
        this.updateCount = updateCount;
        this.error = error;
        this.consumed = resultSet == null;
    }

    static JdbcResult rows(Connection c, Statement st, ResultSet rs) {
        return new JdbcResult(c, st, rs, -1, null);
    }

    static JdbcResult updated(Connection c, Statement st, long count) {
        return new JdbcResult(c, st, null, count, null);
    }

    static JdbcResult failed(SQLException error) {
        return new JdbcResult(null, null, null, -1, error);
    }

    public boolean hasRows() {
        return resultSet != null;
    }

    public boolean isError() {
        return error != null;
    }

    public ResultSet resultSet() {
        return resultSet;
    }

    public long updateCount() {
        return updateCount;
    }

    public SQLException error() {
        return error;
    }

    /** The client received every row; nothing is left to cancel. */
    public void markConsumed() {
        consumed = true;
    }

    @Override
    public void close() {
        if (statement != null && !consumed) {
            try {
                if (!statement.isClosed()) statement.cancel();
            } catch (SQLException | RuntimeException e) {
                log.debug("Statement cancel failed: {}", e.toString());
            }
        }
        closeQuietly(resultSet);
        closeQuietly(statement);
        if (connection != null) JdbcBackend.rollback(connection);
        closeQuietly(connection);
    }

    private static void closeQuietly(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.debug("Closing JDBC resource failed: {}", e.toString());
        }
    }
}
