package org.iceforge.bifrost.gateway.pgwire;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.gateway.jdbc.JdbcBackend;
import org.iceforge.bifrost.gateway.listener.SocketListener;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * PostgreSQL wire-protocol listener for relational-B connectors.
 *
 * <ul>
 *   <li>SSLRequest is declined with 'N'</li>
 *   <li>StartupMessage, then a cleartext password request only for password-protected links</li>
 *   <li>Simple Query and the extended Parse/Bind/Describe/Execute/Sync flow, text format</li>
 * </ul>
 */
@Component
public class PgWireListener extends SocketListener {

    private final ProxyPipeline pipeline;
    private final JdbcBackend backend;
    private final PgSqlAdapter adapter;
    private final Duration idleTimeout;

    public PgWireListener(GatewayProperties props, ProxyPipeline pipeline,
                          @Qualifier("postgresJdbcBackend") JdbcBackend backend) {
        super(Protocol.POSTGRESQL, props);
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.adapter = new PgSqlAdapter(props.maxResponseBytes());
        this.idleTimeout = props.timeouts().idle();
    }

    @Override
    protected Runnable newSession(Socket socket) {
        return new PgWireSession(socket, pipeline, backend, adapter, idleTimeout);
    }
}
