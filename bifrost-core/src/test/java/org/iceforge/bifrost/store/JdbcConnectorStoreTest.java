package org.iceforge.bifrost.store;

import org.iceforge.bifrost.CoreFixture;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.LinkStatus;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcConnectorStoreTest {

    private final CoreFixture fx = new CoreFixture();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void incrementRequests_countsAndStampsLastAccess() {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");

        assertThat(fx.connectorStore.incrementRequests(c.id(), fx.clock.instant())).isTrue();
        assertThat(fx.connectorStore.incrementRequests(c.id(), fx.clock.instant())).isTrue();

        ProxyConnector stored = fx.connectorStore.findById(c.id()).orElseThrow();
        assertThat(stored.totalRequests()).isEqualTo(2);
        assertThat(stored.lastAccessedAt()).isEqualTo(fx.clock.instant());
    }

    @Test
    void revokeCascade_revokesConnectorAndItsLinksOnly() {
        ProxyConnector doomed = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");
        ProxyConnector other = fx.connector(ConnectorType.RELATIONAL_A, "SELECT");
        SharedLink a = fx.link(doomed, null, null);
        SharedLink b = fx.link(doomed, 3, null);
        SharedLink untouched = fx.link(other, null, null);

        assertThat(fx.connectorStore.revokeCascade(doomed.id(), fx.clock.instant())).isEqualTo(2);

        assertThat(fx.connectorStore.findById(doomed.id()).orElseThrow().isRevoked()).isTrue();
        assertThat(fx.linkStore.findById(a.shareId()).orElseThrow().statusAt(fx.clock.instant())).isEqualTo(LinkStatus.REVOKED);
        assertThat(fx.linkStore.findById(b.shareId()).orElseThrow().statusAt(fx.clock.instant())).isEqualTo(LinkStatus.REVOKED);
        assertThat(fx.linkStore.findById(untouched.shareId()).orElseThrow().statusAt(fx.clock.instant())).isEqualTo(LinkStatus.ACTIVE);
        assertThat(fx.connectorStore.incrementRequests(doomed.id(), fx.clock.instant())).isFalse();
        assertThat(fx.connectorStore.findByOwner(CoreFixture.OWNER)).extracting(ProxyConnector::id)
                .containsExactly(other.id());
    }

    @Test
    void revokeCascade_secondCallReportsNothingToDo() {
        ProxyConnector c = fx.connector(ConnectorType.DOCUMENT);

        assertThat(fx.connectorStore.revokeCascade(c.id(), fx.clock.instant())).isZero();
        assertThat(fx.connectorStore.revokeCascade(c.id(), fx.clock.instant())).isEqualTo(-1);
    }

    @Test
    void findByAccessToken_returnsSealedCredentialsUnchanged() {
        ProxyConnector c = fx.connector(ConnectorType.COLUMNAR, "select", "show");

        ProxyConnector stored = fx.connectorStore.findByAccessToken(c.accessToken()).orElseThrow();

        assertThat(stored.credentials()).isEqualTo(c.credentials());
        assertThat(stored.allowedOperations()).containsExactlyInAnyOrder("SELECT", "SHOW");
        assertThat(stored.type()).isEqualTo(ConnectorType.COLUMNAR);
    }
}
