package org.iceforge.bifrost.gateway.share;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.error.MalformedRequestException;
import org.iceforge.bifrost.gateway.http.ApiAdapter;
import org.iceforge.bifrost.gateway.http.HttpEndpoint;
import org.iceforge.bifrost.gateway.http.HttpPayload;
import org.iceforge.bifrost.gateway.jdbc.SqlVerbs;
import org.iceforge.bifrost.gateway.listener.HttpErrors;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.gateway.mongo.MongoAdapter;
import org.iceforge.bifrost.gateway.s3.S3Request;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProtocolAdapter;
import org.iceforge.bifrost.token.ClientCredentials;
import org.iceforge.bifrost.token.TokenResolver;

import java.util.Locale;
import java.util.Set;

/**
 * Shared-link listener. The link id in the path is the token; connector access tokens are
 * not accepted here. The operation depends on the route: {@code INFO}, {@code READ}, the
 * HTTP method, the object operation, the SQL verb or the command name.
 */
final class ShareAdapter implements ProtocolAdapter<ShareRequest, HttpPayload, HttpReply> {

    private static final Set<String> READ_ONLY = Set.of(
            TokenResolver.INFO, TokenResolver.READ, "GET", "HEAD", "OPTIONS", "LIST");

    private final ObjectMapper json;

    ShareAdapter(ObjectMapper json) {
        this.json = json;
    }

    @Override
    public Protocol protocol() {
        return Protocol.SHARED;
    }

    @Override
    public ClientCredentials parseToken(ShareRequest request) {
        String password = request.call().header(ApiAdapter.PASSWORD_HEADER);
        if (password == null) {
            password = request.call().param("password");
        }
        return new ClientCredentials(request.shareId(), password, request.call().header(ApiAdapter.IDENTITY_HEADER));
    }

    @Override
    public String parseOperation(ShareRequest request) {
        return switch (request.route()) {
            case INFO -> TokenResolver.INFO;
            case DATA -> TokenResolver.READ;
            case API -> {
                HttpEndpoint.checkedPath(request.rawRest());
                yield request.call().method().toUpperCase(Locale.ROOT);
            }
            case OBJECTS -> S3Request.of(request.call(), request.shareId(), request.rest()).operation();
            case QUERY -> {
                String verb = SqlVerbs.operation(request.statement());
                if (verb.isEmpty()) {
                    throw new MalformedRequestException("query is required");
                }
                yield verb;
            }
            case COMMAND -> MongoAdapter.commandOperation(request.command().getFirstKey(), request.command());
        };
    }

    @Override
    public boolean isReadOnly(String operation) {
        return READ_ONLY.contains(operation) || SqlVerbs.isReadOnly(operation)
                || MongoAdapter.isReadOnlyCommand(operation);
    }

    @Override
    public long frameResponse(HttpPayload payload, HttpReply out) {
        out.status(payload.status());
        payload.headers().forEach((name, values) -> {
            if (!values.isEmpty()) out.header(name, String.join(", ", values));
        });
        out.body(payload.body(), payload.headers().getFirst("Content-Type"));
        return payload.body().length;
    }

    @Override
    public void frameError(GatewayException error, HttpReply out) {
        HttpErrors.write(out, error, json);
    }

    @Override
    public Set<ConnectorType> acceptedTypes(ShareRequest request) {
        return request.route().connectorTypes();
    }

    @Override
    public boolean acceptsDatasetLinks(ShareRequest request) {
        return request.route().acceptsDatasetLinks();
    }

    @Override
    public boolean acceptsDirectTokens(ShareRequest request) {
        return false;
    }
}
