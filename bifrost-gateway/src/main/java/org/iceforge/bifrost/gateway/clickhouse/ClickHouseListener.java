package org.iceforge.bifrost.gateway.clickhouse;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.error.MalformedRequestException;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.gateway.http.HttpBackend;
import org.iceforge.bifrost.gateway.listener.HttpCall;
import org.iceforge.bifrost.gateway.listener.HttpListener;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * ClickHouse HTTP interface for columnar connectors. {@code /ping} and a bare {@code GET /}
 * are answered locally, as a ClickHouse server would.
 */
@Component
public class ClickHouseListener extends HttpListener {

    private final ProxyPipeline pipeline;
    private final HttpBackend backend;
    private final ClickHouseAdapter adapter = new ClickHouseAdapter();

    public ClickHouseListener(GatewayProperties props, ObjectMapper json, ProxyPipeline pipeline,
                              @Qualifier("clickhouseHttpBackend") HttpBackend backend) {
        super(Protocol.CLICKHOUSE, props, json);
        this.pipeline = pipeline;
        this.backend = backend;
    }

    @Override
    protected HttpReply handle(HttpCall call) {
        if ("/ping".equals(call.path()) || ("GET".equals(call.method()) && "/".equals(call.path())
                && ClickHouseAdapter.sql(call).isBlank())) {
            return new HttpReply().text(200, "Ok.\n");
        }
        HttpReply reply = new HttpReply();
        try {
            pipeline.handle(adapter, call, call.client(),
                    (c, grant) -> backend.forward(ClickHouseAdapter.forward(c), grant), reply);
        } catch (MalformedRequestException e) {
            adapter.frameError(e, reply);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return reply;
    }
}
