package org.iceforge.bifrost.gateway.share;

import org.iceforge.bifrost.gateway.listener.AdvertisedEndpoints;
import org.iceforge.bifrost.links.SharedLinkManager;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.pipeline.Protocol;
import org.iceforge.bifrost.token.AuthorizationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public description of a shared link: what it grants and how to connect through the
 * gateway. Nothing about the real backend is included.
 */
final class LinkDescriptors {

    private final AdvertisedEndpoints endpoints;

    LinkDescriptors(AdvertisedEndpoints endpoints) {
        this.endpoints = endpoints;
    }

    Map<String, Object> describe(AuthorizationResult grant) {
        SharedLink link = grant.link();
        String shareUrl = endpoints.publicBaseUrl() + SharedLinkManager.PUBLIC_PATH_PREFIX + link.shareId();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("share_id", link.shareId());
        body.put("name", link.name());
        body.put("description", link.description());
        body.put("requires_authentication", link.requiresAuthentication());
        body.put("password_protected", link.hasPassword());
        body.put("expires_at", link.expiresAt() == null ? null : link.expiresAt().toString());
        body.put("max_uses", link.maxUses());
        body.put("share_url", shareUrl);
        if (grant.isDataset()) {
            body.put("target", "dataset");
            body.put("data_url", shareUrl + "/data");
        } else {
            ConnectorType type = grant.connector().type();
            body.put("target", "connector");
            body.put("connector_type", type.wireName());
            body.put("allowed_operations", grant.connector().allowedOperations().stream().sorted().toList());
            body.put("connection", connection(type, link, shareUrl));
        }
        return body;
    }

    private Map<String, Object> connection(ConnectorType type, SharedLink link, String shareUrl) {
        Protocol protocol = Protocol.serving(type);
        String host = endpoints.host();
        int port = endpoints.port(protocol);
        String id = link.shareId();

        Map<String, Object> c = new LinkedHashMap<>();
        c.put("protocol", protocol.id());
        c.put("host", host);
        c.put("port", port);
        switch (type) {
            case RELATIONAL_A -> {
                c.put("username", id);
                c.put("example", "mysql -h " + host + " -P " + port + " -u " + id
                        + (link.hasPassword() ? " --enable-cleartext-plugin -p" : ""));
                c.put("share_query_url", shareUrl + "/query");
            }
            case RELATIONAL_B -> {
                c.put("username", id);
                c.put("example", "psql \"host=" + host + " port=" + port + " user=" + id + " dbname=proxy\"");
                c.put("share_query_url", shareUrl + "/query");
            }
            case COLUMNAR -> {
                c.put("username", id);
                c.put("url", "http://" + host + ":" + port + "/?user=" + id);
                c.put("share_query_url", shareUrl + "/query");
            }
            case DOCUMENT -> {
                c.put("username", id);
                c.put("auth_mechanism", "PLAIN");
                c.put("example", "mongodb://" + id + (link.hasPassword() ? ":<password>" : ":")
                        + "@" + host + ":" + port + "/?authMechanism=PLAIN&authSource=%24external");
                c.put("share_command_url", shareUrl + "/command");
            }
            case OBJECT_STORE -> {
                c.put("url", "http://" + host + ":" + port + "/" + id + "/");
                c.put("share_objects_url", shareUrl + "/objects/");
            }
            case GENERIC_API -> {
                c.put("url", "http://" + host + ":" + port + "/?token=" + id);
                c.put("share_api_url", shareUrl + "/api/");
            }
        }
        return c;
    }
}
