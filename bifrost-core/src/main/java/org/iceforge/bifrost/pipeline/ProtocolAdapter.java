package org.iceforge.bifrost.pipeline;

import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.token.ClientCredentials;

import java.io.IOException;
import java.util.Set;

/**
 * The protocol-specific half of a proxied request.
 *
 * @param <Q> parsed client request
 * @param <B> backend result
 * @param <O> client-side sink the response is framed onto
 */
public interface ProtocolAdapter<Q, B, O> {

    Protocol protocol();

    /** Where the client put its token. Throws {@code MalformedRequestException} when unparseable. */
    ClientCredentials parseToken(Q request);

    /** The operation name checked against the connector's allow-list. */
    String parseOperation(Q request);

    boolean isReadOnly(String operation);

    /** Writes the backend result to the client and returns the payload bytes written. */
    long frameResponse(B backendResult, O out) throws IOException;

    void frameError(GatewayException error, O out) throws IOException;

    /** Connector types this request may reach. Listeners with per-route rules override this. */
    default Set<ConnectorType> acceptedTypes(Q request) {
        return protocol().connectorTypes();
    }

    default boolean acceptsDatasetLinks(Q request) {
        return false;
    }

    /** False for link-only listeners, where a connector's own access token must not work. */
    default boolean acceptsDirectTokens(Q request) {
        return true;
    }
}
