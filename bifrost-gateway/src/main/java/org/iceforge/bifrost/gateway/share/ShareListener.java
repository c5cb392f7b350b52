package org.iceforge.bifrost.gateway.share;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.gateway.http.HttpBackend;
import org.iceforge.bifrost.gateway.jdbc.JdbcBackend;
import org.iceforge.bifrost.gateway.listener.AdvertisedEndpoints;
import org.iceforge.bifrost.gateway.listener.HttpCall;
import org.iceforge.bifrost.gateway.listener.HttpListener;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.gateway.mongo.MongoBackend;
import org.iceforge.bifrost.gateway.s3.S3Backend;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Public entry point for shared links: {@code /share/{shareId}} and the routes below it.
 * Only link ids work here; a connector's own access token is refused.
 */
@Component
public class ShareListener extends HttpListener {

    private final ProxyPipeline pipeline;
    private final ShareAdapter adapter;
    private final ShareBackends backends;

    public ShareListener(GatewayProperties props, ObjectMapper json, ProxyPipeline pipeline,
                         @Qualifier("mysqlJdbcBackend") JdbcBackend mysql,
                         @Qualifier("postgresJdbcBackend") JdbcBackend postgres,
                         @Qualifier("apiHttpBackend") HttpBackend api,
                         @Qualifier("clickhouseHttpBackend") HttpBackend clickhouse,
                         S3Backend objects, MongoBackend documents, DatasetCatalog datasets,
                         AdvertisedEndpoints endpoints) {
        super(Protocol.SHARED, props, json);
        this.pipeline = pipeline;
        this.adapter = new ShareAdapter(json);
        this.backends = new ShareBackends(mysql, postgres, api, clickhouse, objects, documents, datasets,
                new LinkDescriptors(endpoints), json, props.maxResponseBytes());
    }

    @Override
    protected HttpReply handle(HttpCall call) {
        ShareRequest request;
        try {
            request = ShareRequest.parse(call, json);
        } catch (GatewayException e) {
            pipeline.recordRejected(Protocol.SHARED, call.method().toUpperCase(Locale.ROOT), e.code(), call.client());
            throw e;
        }
        HttpReply reply = new HttpReply();
        try {
            pipeline.handle(adapter, request, call.client(), backends::invoke, reply);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return reply;
    }
}
