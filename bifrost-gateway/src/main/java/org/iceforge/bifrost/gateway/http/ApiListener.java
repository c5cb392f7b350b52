package org.iceforge.bifrost.gateway.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.gateway.listener.HttpCall;
import org.iceforge.bifrost.gateway.listener.HttpListener;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Relays {@code /{path}} to the generic API connector the token resolves to. */
@Component
public class ApiListener extends HttpListener {

    private final ProxyPipeline pipeline;
    private final HttpBackend backend;
    private final ApiAdapter adapter;

    public ApiListener(GatewayProperties props, ObjectMapper json, ProxyPipeline pipeline,
                       @Qualifier("apiHttpBackend") HttpBackend backend) {
        super(Protocol.API, props, json);
        this.pipeline = pipeline;
        this.backend = backend;
        this.adapter = new ApiAdapter(json);
    }

    @Override
    protected HttpReply handle(HttpCall call) {
        HttpReply reply = new HttpReply();
        try {
            pipeline.handle(adapter, call, call.client(),
                    (c, grant) -> backend.forward(ApiAdapter.forward(c, c.rawPath()), grant), reply);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return reply;
    }
}
