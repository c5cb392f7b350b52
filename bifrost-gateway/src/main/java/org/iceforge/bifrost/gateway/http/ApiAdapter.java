package org.iceforge.bifrost.gateway.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.listener.HttpCall;
import org.iceforge.bifrost.gateway.listener.HttpErrors;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProtocolAdapter;
import org.iceforge.bifrost.token.ClientCredentials;

import java.util.Locale;
import java.util.Set;

/**
 * Generic API listener: the token is the {@code token} query parameter or a bearer
 * credential, and the operation is the HTTP method.
 */
public class ApiAdapter implements ProtocolAdapter<HttpCall, HttpPayload, HttpReply> {

    public static final String PASSWORD_HEADER = "X-Share-Password";
    public static final String IDENTITY_HEADER = "X-Identity-Token";

    private static final Set<String> READ_ONLY = Set.of("GET", "HEAD", "OPTIONS");

    private final ObjectMapper json;

    public ApiAdapter(ObjectMapper json) {
        this.json = json;
    }

    @Override
    public Protocol protocol() {
        return Protocol.API;
    }

    @Override
    public ClientCredentials parseToken(HttpCall call) {
        String token = call.param("token");
        if (token == null || token.isBlank()) {
            token = call.bearer();
        }
        String password = call.header(PASSWORD_HEADER);
        if (password == null) {
            password = call.param("password");
        }
        return new ClientCredentials(token, password, call.header(IDENTITY_HEADER));
    }

    @Override
    public String parseOperation(HttpCall call) {
        HttpEndpoint.checkedPath(call.rawPath());
        return call.method().toUpperCase(Locale.ROOT);
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
        HttpErrors.write(out, error, json);
    }

    /** The request as it leaves for the backend: credentials removed, path unchanged. */
    public static HttpForward forward(HttpCall call, String rawPath) {
        return new HttpForward(call.method(), rawPath,
                ForwardHeaders.query(call.query(), ForwardHeaders.CREDENTIAL_PARAMS),
                ForwardHeaders.request(call.headers()), call.body());
    }
}
