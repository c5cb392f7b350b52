package org.iceforge.bifrost.pipeline.backend;

import org.iceforge.bifrost.audit.AlertSink;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.iceforge.bifrost.vault.CredentialHandle;
import org.iceforge.bifrost.vault.CredentialVault;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class BackendPoolsTest {

    static final class FakePool implements AutoCloseable {
        final String host;
        boolean closed;

        FakePool(String host) {
            this.host = host;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private final CredentialVault vault = new CredentialVault(new byte[16], mock(AlertSink.class));
    private final AtomicInteger built = new AtomicInteger();
    private final BackendPools<FakePool> pools = new BackendPools<>("fake", (id, secrets) -> {
        built.incrementAndGet();
        return new FakePool(secrets.require("host"));
    });

    private CredentialHandle handle(String id, String host) {
        return vault.open(id, vault.encrypt(id, ConnectorSecrets.of(Map.of("host", host))));
    }

    @Test
    void acquire_buildsOncePerConnector() {
        FakePool a1 = pools.acquire(handle("a", "host-a"));
        FakePool a2 = pools.acquire(handle("a", "host-a"));
        FakePool b = pools.acquire(handle("b", "host-b"));

        assertThat(a1).isSameAs(a2);
        assertThat(b).isNotSameAs(a1);
        assertThat(b.host).isEqualTo("host-b");
        assertThat(built.get()).isEqualTo(2);
    }

    @Test
    void evict_closesAndRebuildsOnNextAcquire() {
        FakePool first = pools.acquire(handle("a", "host-a"));

        pools.evict("a");
        FakePool second = pools.acquire(handle("a", "host-a2"));

        assertThat(first.closed).isTrue();
        assertThat(second.host).isEqualTo("host-a2");
        assertThat(pools.size()).isEqualTo(1);
    }

    @Test
    void close_closesEverything() {
        FakePool a = pools.acquire(handle("a", "x"));
        FakePool b = pools.acquire(handle("b", "y"));

        pools.close();

        assertThat(a.closed).isTrue();
        assertThat(b.closed).isTrue();
        assertThat(pools.size()).isZero();
    }
}
