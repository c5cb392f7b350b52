package org.iceforge.bifrost.gateway.s3;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.gateway.listener.HttpCall;
import org.iceforge.bifrost.gateway.listener.HttpListener;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Object-store listener: {@code GET|HEAD|PUT|DELETE /{token}/{key}}, listing on prefixes. */
@Component
public class S3Listener extends HttpListener {

    private final ProxyPipeline pipeline;
    private final S3Backend backend;
    private final S3Adapter adapter = new S3Adapter();

    public S3Listener(GatewayProperties props, ObjectMapper json, ProxyPipeline pipeline, S3Backend backend) {
        super(Protocol.S3, props, json);
        this.pipeline = pipeline;
        this.backend = backend;
    }

    @Override
    protected HttpReply handle(HttpCall call) {
        HttpReply reply = new HttpReply();
        try {
            pipeline.handle(adapter, S3Request.parse(call), call.client(), backend::execute, reply);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return reply;
    }
}
