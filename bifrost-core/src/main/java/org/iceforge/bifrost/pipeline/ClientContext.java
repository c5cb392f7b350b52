package org.iceforge.bifrost.pipeline;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/** Where a request came from. */
public record ClientContext(String remoteAddress) {

    public static ClientContext of(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return new ClientContext(inet.getHostString() + ":" + inet.getPort());
        }
        return new ClientContext(address == null ? null : address.toString());
    }
}
