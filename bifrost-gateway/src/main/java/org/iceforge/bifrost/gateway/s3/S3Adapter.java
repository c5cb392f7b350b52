package org.iceforge.bifrost.gateway.s3;

import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.http.ApiAdapter;
import org.iceforge.bifrost.gateway.http.HttpPayload;
import org.iceforge.bifrost.gateway.listener.HttpErrors;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProtocolAdapter;
import org.iceforge.bifrost.token.ClientCredentials;

import java.util.Set;

/** S3-style REST: the first path segment is the token, the rest is the object key. */
public class S3Adapter implements ProtocolAdapter<S3Request, HttpPayload, HttpReply> {

    private static final Set<String> READ_ONLY = Set.of("GET", "HEAD", "LIST");

    @Override
    public Protocol protocol() {
        return Protocol.S3;
    }

    @Override
    public ClientCredentials parseToken(S3Request request) {
        String password = request.call().header(ApiAdapter.PASSWORD_HEADER);
        return new ClientCredentials(request.token(), password, request.call().header(ApiAdapter.IDENTITY_HEADER));
    }

    @Override
    public String parseOperation(S3Request request) {
        return request.operation();
    }

    @Override
    public boolean isReadOnly(String operation) {
        return READ_ONLY.contains(operation);
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
        int status = HttpErrors.status(error.code());
        out.status(status).body(S3Xml.error(errorCode(status), error.code().publicMessage(), null), S3Xml.CONTENT_TYPE);
    }

    static String errorCode(int status) {
        return switch (status) {
            case 400 -> "InvalidRequest";
            case 401, 403 -> "AccessDenied";
            case 404 -> "NoSuchKey";
            case 502 -> "BadGateway";
            case 503 -> "ServiceUnavailable";
            case 504 -> "RequestTimeout";
            default -> "InternalError";
        };
    }
}
