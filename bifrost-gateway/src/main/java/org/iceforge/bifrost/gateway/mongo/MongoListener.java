package org.iceforge.bifrost.gateway.mongo;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.gateway.listener.SocketListener;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.springframework.stereotype.Component;

import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/** MongoDB wire protocol listener for document connectors. */
@Component
public class MongoListener extends SocketListener {

    private final ProxyPipeline pipeline;
    private final MongoBackend backend;
    private final MongoAdapter adapter;
    private final Duration idleTimeout;

    public MongoListener(GatewayProperties props, ProxyPipeline pipeline, MongoBackend backend) {
        super(Protocol.MONGODB, props);
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.adapter = new MongoAdapter(props.maxResponseBytes());
        this.idleTimeout = props.timeouts().idle();
    }

    @Override
    protected Runnable newSession(Socket socket) {
        return new MongoSession(socket, pipeline, backend, adapter, idleTimeout);
    }
}
