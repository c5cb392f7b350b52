package org.iceforge.bifrost.gateway.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.pipeline.backend.BackendPools;
import org.iceforge.bifrost.token.AuthorizationResult;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Runs statements on relational connectors through one Hikari pool per connector.
 */
public class JdbcBackend implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcBackend.class);

    private final Dialect dialect;
    private final GatewayProperties.Pool pool;
    private final GatewayProperties.Timeouts timeouts;
    private final BackendPools<HikariDataSource> pools;

    public JdbcBackend(Dialect dialect, GatewayProperties props) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.pool = props.pool();
        this.timeouts = props.timeouts();
        this.pools = new BackendPools<>("jdbc-" + dialect.name().toLowerCase(Locale.ROOT), this::openPool);
    }

    private HikariDataSource openPool(String connectorId, ConnectorSecrets secrets) {
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("bifrost-" + connectorId);
        cfg.setJdbcUrl(JdbcUrls.forConnector(dialect, secrets));
        secrets.get("username").ifPresent(cfg::setUsername);
        secrets.get("password").ifPresent(cfg::setPassword);
        cfg.setMaximumPoolSize(secrets.getInt("max_pool_size", pool.maxSize()));
        cfg.setMinimumIdle(0);
        cfg.setIdleTimeout(pool.idleTimeout().toMillis());
        cfg.setConnectionTimeout(timeouts.poolAcquire().toMillis());
        // Do not fail pool creation when the backend is down; the first acquire reports it.
        cfg.setInitializationFailTimeout(-1);
        return new HikariDataSource(cfg);
    }

    /**
     * Executes {@code sql} on the granted connector. SQL errors the backend raises for the
     * statement come back as an error result; connection and timeout problems throw.
     *
     * <p>Connectors whose allow-list holds only read verbs run every statement inside a
     * read-only transaction that is rolled back when the result closes, so functions with
     * side effects cannot write either.
     */
    public JdbcResult execute(String sql, AuthorizationResult grant) {
        HikariDataSource ds = pools.acquire(grant.credentials());

        Connection c;
        try {
            c = ds.getConnection();
        } catch (SQLException e) {
            throw connectionFailure(e);
        }

        Statement st = null;
        try {
            if (isReadOnlyConnector(grant)) {
                c.setReadOnly(true);
                c.setAutoCommit(false);
            }
            st = c.createStatement();
            st.setQueryTimeout(seconds(timeouts.backendResponse()));
            if (st.execute(sql)) {
                ResultSet rs = st.getResultSet();
                return JdbcResult.rows(c, st, rs);
            }
            return JdbcResult.updated(c, st, st.getUpdateCount());
        } catch (SQLException e) {
            close(st);
            rollback(c);
            close(c);
            if (e instanceof SQLTimeoutException) {
                throw new GatewayException(ErrorCode.BACKEND_TIMEOUT, "statement timed out", e);
            }
            if (isConnectionProblem(e)) {
                throw connectionFailure(e);
            }
            return JdbcResult.failed(e);
        }
    }

    static boolean isReadOnlyConnector(AuthorizationResult grant) {
        return grant.connector() != null
                && grant.connector().allowedOperations().stream().allMatch(SqlVerbs::isReadOnly);
    }

    public void evict(String connectorId) {
        pools.evict(connectorId);
    }

    public int openPools() {
        return pools.size();
    }

    @Override
    public void close() {
        pools.close();
    }

    private static GatewayException connectionFailure(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return new GatewayException(ErrorCode.BACKEND_TIMEOUT, "backend connection timed out", e);
        }
        return new GatewayException(ErrorCode.BACKEND_UNREACHABLE, "backend connection failed: " + e.getMessage(), e);
    }

    /** SQLSTATE class 08 is a connection exception in every dialect we speak. */
    private static boolean isConnectionProblem(SQLException e) {
        String state = e.getSQLState();
        return e instanceof SQLTransientConnectionException || (state != null && state.startsWith("08"));
    }

    private static int seconds(Duration d) {
        return (int) Math.max(1, d.toSeconds());
    }

    static void rollback(Connection c) {
        try {
            if (!c.getAutoCommit()) c.rollback();
        } catch (SQLException e) {
            log.debug("Rollback of read-only transaction failed: {}", e.toString());
        }
    }

    private static void close(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.debug("Closing JDBC resource after failure: {}", e.toString());
        }
    }
}
