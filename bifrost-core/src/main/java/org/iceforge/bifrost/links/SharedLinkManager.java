package org.iceforge.bifrost.links;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.model.LinkStatus;
import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.model.SharingLevel;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.store.SharedLinkStore;
import org.iceforge.bifrost.token.TokenGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class SharedLinkManager {
    private static final Logger log = LoggerFactory.getLogger(SharedLinkManager.class);
    public static final String PUBLIC_PATH_PREFIX = "/share/";

    private final SharedLinkStore store;
    private final ConnectorRegistry registry;
    private final PasswordHasher hasher;
    private final TokenGenerator tokens;
    private final Clock clock;

    public SharedLinkManager(SharedLinkStore store, ConnectorRegistry registry, PasswordHasher hasher,
                             TokenGenerator tokens, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a link. Connector targets must be live and owned by the creator; dataset
     * ownership is checked by the caller.
     */
    public SharedLink create(NewSharedLink req) {
        Objects.requireNonNull(req, "request");
        if (req.target() == null) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "target is required");
        }
        if (req.createdBy() == null || req.createdBy().isBlank()) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "createdBy is required");
        }
        if (req.maxUses() != null && req.maxUses() <= 0) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "maxUses must be positive");
        }
        Instant now = clock.instant();
        if (req.expiresAt() != null && !req.expiresAt().isAfter(now)) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "expiresAt must be in the future");
        }
        if (req.target().isConnector()) {
            registry.get(req.createdBy(), req.target().id());
        }

        SharingLevel level = req.sharingLevel() == null ? SharingLevel.PUBLIC : req.sharingLevel();
        boolean requiresAuth = req.requiresAuthentication() != null
                ? req.requiresAuthentication()
                : level == SharingLevel.RESTRICTED;
        String passwordHash = req.password() == null || req.password().isEmpty() ? null : hasher.hash(req.password());
        String shareId = tokens.shareId();
        String name = req.name() == null || req.name().isBlank() ? "Shared " + req.target().id() : req.name().trim();

        SharedLink link = new SharedLink(shareId, req.target(), name, req.description(),
                PUBLIC_PATH_PREFIX + shareId, requiresAuth, passwordHash, req.expiresAt(), req.maxUses(), 0L,
                req.allowedUsers() == null ? List.of() : req.allowedUsers(), req.createdBy(), now, null);
        store.insert(link);
        log.info("Created shared link {} target={} level={} auth={} maxUses={} expiresAt={}",
                shareId, req.target(), level, requiresAuth, req.maxUses(), req.expiresAt());
        return link;
    }

    /** Idempotent: revoking an already revoked link is a no-op with the same result. */
    public LinkStatus revoke(String shareId) {
        require(shareId);
        if (store.revoke(shareId, clock.instant())) {
            log.info("Revoked shared link {}", shareId);
        }
        return LinkStatus.REVOKED;
    }

    public LinkStatus getStatus(String shareId) {
        return require(shareId).statusAt(clock.instant());
    }

    public Optional<SharedLink> get(String shareId) {
        return store.findById(shareId);
    }

    public List<SharedLink> listForTarget(LinkTarget target) {
        return store.findByTarget(target);
    }

    private SharedLink require(String shareId) {
        return store.findById(shareId)
                .orElseThrow(() -> new GatewayException(ErrorCode.LINK_NOT_FOUND, "shared link not found"));
    }
}
