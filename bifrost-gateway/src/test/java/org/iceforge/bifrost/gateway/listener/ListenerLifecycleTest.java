package org.iceforge.bifrost.gateway.listener;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.pipeline.Protocol;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ListenerLifecycleTest {

    private static Map<Protocol, ListenerLifecycle.Status> byProtocol(ListenerLifecycle lifecycle) {
        return lifecycle.statuses().stream()
                .collect(Collectors.toMap(ListenerLifecycle.Status::protocol, Function.identity()));
    }

    @Test
    void portInUseFailsOnlyThatListener() throws Exception {
        try (ServerSocket taken = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            GatewayProperties props = SocketListenerTest.props(Duration.ofSeconds(5), Map.of(
                    "mysql", new GatewayProperties.Listener(true, "127.0.0.1", taken.getLocalPort()),
                    "postgresql", new GatewayProperties.Listener(true, "127.0.0.1", 0),
                    "api", new GatewayProperties.Listener(false, "127.0.0.1", 0)));
            SocketListenerTest.WaitingListener mysql = new SocketListenerTest.WaitingListener(Protocol.MYSQL, props);
            SocketListenerTest.WaitingListener postgres = new SocketListenerTest.WaitingListener(Protocol.POSTGRESQL, props);
            SocketListenerTest.WaitingListener api = new SocketListenerTest.WaitingListener(Protocol.API, props);
            ListenerLifecycle lifecycle = new ListenerLifecycle(List.of(mysql, postgres, api), props);

            lifecycle.start();
            try {
                Map<Protocol, ListenerLifecycle.Status> statuses = byProtocol(lifecycle);

                assertThat(lifecycle.isRunning()).isTrue();
                assertThat(statuses.get(Protocol.MYSQL).state()).isEqualTo(ListenerLifecycle.State.FAILED);
                assertThat(statuses.get(Protocol.MYSQL).error()).isNotBlank();
                assertThat(statuses.get(Protocol.POSTGRESQL).state()).isEqualTo(ListenerLifecycle.State.RUNNING);
                assertThat(statuses.get(Protocol.API).state()).isEqualTo(ListenerLifecycle.State.DISABLED);
                assertThat(statuses.get(Protocol.S3).state()).isEqualTo(ListenerLifecycle.State.DISABLED);

                // the healthy listener still accepts clients
                try (Socket client = new Socket("127.0.0.1", lifecycle.port(Protocol.POSTGRESQL))) {
                    assertThat(client.isConnected()).isTrue();
                }
            } finally {
                lifecycle.stop();
            }

            assertThat(byProtocol(lifecycle).get(Protocol.POSTGRESQL).state()).isEqualTo(ListenerLifecycle.State.STOPPED);
        }
    }
}
