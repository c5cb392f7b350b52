package org.iceforge.bifrost.gateway.api;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.listener.AdvertisedEndpoints;
import org.iceforge.bifrost.gateway.share.DatasetCatalog;
import org.iceforge.bifrost.links.NewSharedLink;
import org.iceforge.bifrost.links.SharedLinkManager;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.model.SharingLevel;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.registry.ConnectorUpdate;
import org.iceforge.bifrost.registry.NewConnector;
import org.iceforge.bifrost.usage.UsageAccountant;
import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Owner-facing administration of connectors and shared links.
 *
 * <p>The owning application authenticates its users and passes the owner id in
 * {@code X-Owner-Id}; everything here is scoped to that owner.
 */
@RestController
@RequestMapping("/api")
public class AdminController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final ConnectorRegistry registry;
    private final SharedLinkManager links;
    private final UsageAccountant usage;
    private final DatasetCatalog datasets;
    private final AdvertisedEndpoints endpoints;
    private final Clock clock;

    public AdminController(ConnectorRegistry registry, SharedLinkManager links, UsageAccountant usage,
                           DatasetCatalog datasets, AdvertisedEndpoints endpoints, Clock clock) {
        this.registry = Objects.requireNonNull(registry);
        this.links = Objects.requireNonNull(links);
        this.usage = Objects.requireNonNull(usage);
        this.datasets = Objects.requireNonNull(datasets);
        this.endpoints = Objects.requireNonNull(endpoints);
        this.clock = Objects.requireNonNull(clock);
    }

    @PostMapping("/connectors")
    @ResponseStatus(HttpStatus.CREATED)
    public AdminModels.ConnectorView register(@RequestHeader(OWNER_HEADER) String owner,
                                              @RequestBody AdminModels.ConnectorRequest req) {
        ConnectorType type;
        try {
            type = ConnectorType.fromWireName(req.type());
        } catch (IllegalArgumentException e) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, e.getMessage(), e);
        }
        ProxyConnector c = registry.register(new NewConnector(owner, req.name(), req.description(), type,
                secrets(req.connectionConfig()), req.allowedOperations(), Boolean.TRUE.equals(req.visibleToOthers())));
        return view(c);
    }

    @GetMapping("/connectors")
    public List<AdminModels.ConnectorView> list(@RequestHeader(OWNER_HEADER) String owner) {
        return registry.listForOwner(owner).stream()
                .filter(c -> !c.isRevoked())
                .map(this::view)
                .toList();
    }

    @GetMapping("/connectors/{id}")
    public AdminModels.ConnectorView get(@RequestHeader(OWNER_HEADER) String owner, @PathVariable String id) {
        return view(registry.get(owner, id));
    }

    @PatchMapping("/connectors/{id}")
    public AdminModels.ConnectorView update(@RequestHeader(OWNER_HEADER) String owner, @PathVariable String id,
                                            @RequestBody AdminModels.ConnectorUpdateRequest req) {
        ConnectorSecrets secrets = req.connectionConfig() == null ? null : secrets(req.connectionConfig());
        return view(registry.update(owner, id, new ConnectorUpdate(req.name(), req.description(), secrets,
                req.allowedOperations(), req.visibleToOthers())));
    }

    @DeleteMapping("/connectors/{id}")
    public AdminModels.DeletedConnector delete(@RequestHeader(OWNER_HEADER) String owner, @PathVariable String id) {
        return new AdminModels.DeletedConnector(id, registry.delete(owner, id));
    }

    @GetMapping("/connectors/{id}/links")
    public List<AdminModels.LinkView> connectorLinks(@RequestHeader(OWNER_HEADER) String owner,
                                                     @PathVariable String id) {
        registry.get(owner, id);
        return links.listForTarget(LinkTarget.connector(id)).stream().map(this::view).toList();
    }

    @PostMapping("/links")
    @ResponseStatus(HttpStatus.CREATED)
    public AdminModels.LinkView createLink(@RequestHeader(OWNER_HEADER) String owner,
                                           @RequestBody AdminModels.LinkRequest req) {
        boolean hasConnector = req.connectorId() != null && !req.connectorId().isBlank();
        boolean hasDataset = req.datasetId() != null && !req.datasetId().isBlank();
        if (hasConnector == hasDataset) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "exactly one of connector_id and dataset_id is required");
        }
        if (hasDataset && datasets.find(req.datasetId()).isEmpty()) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "unknown dataset " + req.datasetId());
        }
        LinkTarget target = hasConnector ? LinkTarget.connector(req.connectorId()) : LinkTarget.dataset(req.datasetId());
        SharedLink link = links.create(new NewSharedLink(target, req.name(), req.description(), owner,
                sharingLevel(req.sharingLevel()), req.requiresAuthentication(), req.password(), expiresAt(req),
                req.maxUses(), req.allowedUsers()));
        return view(link);
    }

    @GetMapping("/links/{shareId}")
    public AdminModels.LinkView getLink(@RequestHeader(OWNER_HEADER) String owner, @PathVariable String shareId) {
        return view(ownedLink(owner, shareId));
    }

    @GetMapping("/links/{shareId}/status")
    public AdminModels.StatusView linkStatus(@RequestHeader(OWNER_HEADER) String owner, @PathVariable String shareId) {
        ownedLink(owner, shareId);
        return new AdminModels.StatusView(shareId, links.getStatus(shareId));
    }

    @DeleteMapping("/links/{shareId}")
    public AdminModels.StatusView revokeLink(@RequestHeader(OWNER_HEADER) String owner, @PathVariable String shareId) {
        ownedLink(owner, shareId);
        return new AdminModels.StatusView(shareId, links.revoke(shareId));
    }

    /** Usage of a connector or a link, whichever the id names. */
    @GetMapping("/usage/{id}")
    public AdminModels.UsageView usage(@RequestHeader(OWNER_HEADER) String owner, @PathVariable String id) {
        SharedLink link = links.get(id).filter(l -> owner.equals(l.createdBy())).orElse(null);
        if (link != null) {
            return AdminModels.UsageView.of(id, link.currentUses(), null, usage.stats().get(id));
        }
        ProxyConnector c = registry.get(owner, id);
        return AdminModels.UsageView.of(id, c.totalRequests(), c.lastAccessedAt(), usage.stats().get(id));
    }

    private SharedLink ownedLink(String owner, String shareId) {
        return links.get(shareId)
                .filter(l -> owner.equals(l.createdBy()))
                .orElseThrow(() -> new GatewayException(ErrorCode.LINK_NOT_FOUND, "shared link " + shareId + " not found"));
    }

    private Instant expiresAt(AdminModels.LinkRequest req) {
        if (req.expiresAt() != null) {
            return req.expiresAt();
        }
        if (req.expiresInHours() != null) {
            if (req.expiresInHours() <= 0) {
                throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "expires_in_hours must be positive");
            }
            return clock.instant().plus(Duration.ofHours(req.expiresInHours()));
        }
        return null;
    }

    private static SharingLevel sharingLevel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return SharingLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "unknown sharing level " + value, e);
        }
    }

    private static ConnectorSecrets secrets(Map<String, String> config) {
        if (config == null || config.isEmpty()) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "connection_config is required");
        }
        return ConnectorSecrets.of(config);
    }

    private AdminModels.ConnectorView view(ProxyConnector c) {
        return AdminModels.ConnectorView.of(c, endpoints.hostPort(Protocol.serving(c.type())));
    }

    private AdminModels.LinkView view(SharedLink l) {
        return AdminModels.LinkView.of(l, endpoints.publicBaseUrl() + l.publicPath(), l.statusAt(clock.instant()));
    }
}
