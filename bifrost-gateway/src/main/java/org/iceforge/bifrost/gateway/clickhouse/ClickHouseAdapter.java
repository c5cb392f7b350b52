package org.iceforge.bifrost.gateway.clickhouse;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.http.ApiAdapter;
import org.iceforge.bifrost.gateway.http.ForwardHeaders;
import org.iceforge.bifrost.gateway.http.HttpEndpoint;
import org.iceforge.bifrost.gateway.http.HttpForward;
import org.iceforge.bifrost.gateway.http.HttpPayload;
import org.iceforge.bifrost.gateway.jdbc.SqlVerbs;
import org.iceforge.bifrost.gateway.listener.HttpCall;
import org.iceforge.bifrost.gateway.listener.HttpErrors;
import org.iceforge.bifrost.gateway.listener.HttpReply;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.pipeline.ProtocolAdapter;
import org.iceforge.bifrost.token.ClientCredentials;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashSet;
import java.util.Set;

/**
 * ClickHouse HTTP interface. The proxy token takes the place of the ClickHouse user and a link
 * password the place of its key; the SQL is the {@code query} parameter followed by the body.
 */
final class ClickHouseAdapter implements ProtocolAdapter<HttpCall, HttpPayload, HttpReply> {

    static final String EXCEPTION_CODE_HEADER = "X-ClickHouse-Exception-Code";

    private static final Set<String> STRIPPED_PARAMS;

    static {
        Set<String> s = new HashSet<>(ForwardHeaders.CREDENTIAL_PARAMS);
        s.add("user");
        STRIPPED_PARAMS = Set.copyOf(s);
    }

    @Override
    public Protocol protocol() {
        return Protocol.CLICKHOUSE;
    }

    @Override
    public ClientCredentials parseToken(HttpCall call) {
        String[] basic = basic(call.header("Authorization"));
        String user = first(call.header("X-ClickHouse-User"), call.param("user"), basic[0]);
        String key = first(call.header("X-ClickHouse-Key"), call.param("password"), basic[1]);
        return new ClientCredentials(user, key, call.header(ApiAdapter.IDENTITY_HEADER));
    }

    @Override
    public String parseOperation(HttpCall call) {
        HttpEndpoint.checkedPath(call.rawPath());
        return SqlVerbs.operation(sql(call));
    }

    @Override
    public boolean isReadOnly(String operation) {
        return SqlVerbs.isReadOnly(operation);
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
        int code = exceptionCode(error.code());
        out.text(HttpErrors.status(error.code()),
                "Code: " + code + ". DB::Exception: " + error.code().publicMessage() + ". (BIFROST)\n");
        out.header(EXCEPTION_CODE_HEADER, String.valueOf(code));
    }

    /** {@code query} parameter, then the body, joined the way the ClickHouse server joins them. */
    static String sql(HttpCall call) {
        String param = call.param("query");
        String body = new String(call.body(), StandardCharsets.UTF_8);
        if (param == null || param.isBlank()) return body;
        if (body.isBlank()) return param;
        return param + "\n" + body;
    }

    static HttpForward forward(HttpCall call) {
        return new HttpForward(call.method(), call.rawPath(),
                ForwardHeaders.query(call.query(), STRIPPED_PARAMS),
                ForwardHeaders.request(call.headers()), call.body());
    }

    static int exceptionCode(ErrorCode code) {
        if (code.isAuthorizationFailure() && code != ErrorCode.OPERATION_NOT_ALLOWED) {
            return 516; // AUTHENTICATION_FAILED
        }
        return switch (code) {
            case OPERATION_NOT_ALLOWED -> 497; // ACCESS_DENIED
            case BACKEND_UNREACHABLE, CONNECTOR_UNAVAILABLE -> 210; // NETWORK_ERROR
            case BACKEND_TIMEOUT -> 159; // TIMEOUT_EXCEEDED
            case RESPONSE_TOO_LARGE -> 396; // TOO_MANY_ROWS_OR_BYTES
            case MALFORMED_REQUEST -> 62; // SYNTAX_ERROR
            case INVALID_ARGUMENT -> 36; // BAD_ARGUMENTS
            default -> 1002; // UNKNOWN_EXCEPTION
        };
    }

    private static String[] basic(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, "Basic ", 0, 6)) {
            return new String[2];
        }
        try {
            String decoded = new String(Base64.getDecoder().decode(authorization.substring(6).trim()),
                    StandardCharsets.UTF_8);
            int colon = decoded.indexOf(':');
            return colon < 0
                    ? new String[]{decoded, null}
                    : new String[]{decoded.substring(0, colon), decoded.substring(colon + 1)};
        } catch (IllegalArgumentException e) {
            return new String[2];
        }
    }

    private static String first(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isEmpty()) return c;
        }
        return null;
    }
}
