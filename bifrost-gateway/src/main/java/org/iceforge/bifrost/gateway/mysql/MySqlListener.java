package org.iceforge.bifrost.gateway.mysql;

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

/** MySQL client/server protocol listener for relational-A connectors. */
@Component
public class MySqlListener extends SocketListener {

    private final ProxyPipeline pipeline;
    private final JdbcBackend backend;
    private final MySqlSqlAdapter adapter;
    private final Duration idleTimeout;

    public MySqlListener(GatewayProperties props, ProxyPipeline pipeline,
                         @Qualifier("mysqlJdbcBackend") JdbcBackend backend) {
        super(Protocol.MYSQL, props);
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.adapter = new MySqlSqlAdapter(props.maxResponseBytes());
        this.idleTimeout = props.timeouts().idle();
    }

    @Override
    protected Runnable newSession(Socket socket) {
        return new MySqlSession(socket, pipeline, backend, adapter, idleTimeout);
    }
}
