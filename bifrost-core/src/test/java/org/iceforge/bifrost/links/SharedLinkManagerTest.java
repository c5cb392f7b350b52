package org.iceforge.bifrost.links;

import org.iceforge.bifrost.CoreFixture;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.LinkStatus;
import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.model.SharingLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SharedLinkManagerTest {

    private final CoreFixture fx = new CoreFixture();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private NewSharedLink request(LinkTarget target, SharingLevel level) {
        return new NewSharedLink(target, null, null, CoreFixture.OWNER, level, null, null, null, null, List.of());
    }

    @Test
    void publicLink_isUnauthenticatedAndUnlimited() {
        ProxyConnector c = fx.connector(ConnectorType.RELATIONAL_B, "SELECT");

        SharedLink link = fx.links.create(request(LinkTarget.connector(c.id()), SharingLevel.PUBLIC));

        assertThat(link.requiresAuthentication()).isFalse();
        assertThat(link.maxUses()).isNull();
        assertThat(link.expiresAt()).isNull();
        assertThat(link.hasPassword()).isFalse();
        assertThat(link.name()).isEqualTo("Shared " + c.id());
        assertThat(fx.links.getStatus(link.shareId())).isEqualTo(LinkStatus.ACTIVE);
    }

    @Test
    void restrictedLink_requiresAuthenticationByDefault_unlessOverridden() {
        SharedLink restricted = fx.links.create(request(LinkTarget.dataset("ds-1"), SharingLevel.RESTRICTED));
        SharedLink overridden = fx.links.create(new NewSharedLink(LinkTarget.dataset("ds-1"), "n", null,
                CoreFixture.OWNER, SharingLevel.RESTRICTED, false, null, null, null, null));

        assertThat(restricted.requiresAuthentication()).isTrue();
        assertThat(overridden.requiresAuthentication()).isFalse();
    }

    @Test
    void password_isStoredHashed() {
        ProxyConnector c = fx.connector(ConnectorType.GENERIC_API);

        SharedLink link = fx.link(c, null, "open sesame");

        assertThat(link.passwordHash()).doesNotContain("open sesame").contains("$");
        assertThat(fx.hasher.matches("open sesame", link.passwordHash())).isTrue();
        assertThat(link.toString()).doesNotContain(link.passwordHash());
    }

    @Test
    void revoke_twice_returnsSameTerminalState() {
        SharedLink link = fx.link(fx.connector(ConnectorType.GENERIC_API), 2, null);

        assertThat(fx.links.revoke(link.shareId())).isEqualTo(LinkStatus.REVOKED);
        assertThat(fx.links.revoke(link.shareId())).isEqualTo(LinkStatus.REVOKED);
        assertThat(fx.links.getStatus(link.shareId())).isEqualTo(LinkStatus.REVOKED);
    }

    @Test
    void status_turnsExpiredWhenClockPassesExpiry() {
        ProxyConnector c = fx.connector(ConnectorType.GENERIC_API);
        SharedLink link = fx.links.create(new NewSharedLink(LinkTarget.connector(c.id()), "n", null, CoreFixture.OWNER,
                SharingLevel.PUBLIC, null, null, fx.clock.instant().plus(Duration.ofHours(1)), null, null));

        fx.clock.advance(Duration.ofHours(1));

        assertThat(fx.links.getStatus(link.shareId())).isEqualTo(LinkStatus.EXPIRED);
    }

    @Test
    void create_rejectsBadLimitsAndForeignConnectors() {
        ProxyConnector c = fx.connector(ConnectorType.GENERIC_API);

        assertThatThrownBy(() -> fx.links.create(new NewSharedLink(LinkTarget.connector(c.id()), "n", null,
                CoreFixture.OWNER, SharingLevel.PUBLIC, null, null, null, 0, null)))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).code()).isEqualTo(ErrorCode.INVALID_ARGUMENT);
        assertThatThrownBy(() -> fx.links.create(new NewSharedLink(LinkTarget.connector(c.id()), "n", null,
                CoreFixture.OWNER, SharingLevel.PUBLIC, null, null, fx.clock.instant(), null, null)))
                .isInstanceOf(GatewayException.class);
        assertThatThrownBy(() -> fx.links.create(new NewSharedLink(LinkTarget.connector(c.id()), "n", null,
                "intruder", SharingLevel.PUBLIC, null, null, null, null, null)))
                .extracting(e -> ((GatewayException) e).code()).isEqualTo(ErrorCode.CONNECTOR_NOT_FOUND);
    }

    @Test
    void unknownLink_isLinkNotFound() {
        assertThatThrownBy(() -> fx.links.getStatus("nope"))
                .extracting(e -> ((GatewayException) e).code()).isEqualTo(ErrorCode.LINK_NOT_FOUND);
        assertThatThrownBy(() -> fx.links.revoke("nope"))
                .isInstanceOf(GatewayException.class);
    }
}
