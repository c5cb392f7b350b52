package org.iceforge.bifrost.gateway.share;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.BsonDocument;
import org.bson.json.JsonParseException;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.error.MalformedRequestException;
import org.iceforge.bifrost.gateway.listener.HttpCall;
import org.iceforge.bifrost.links.SharedLinkManager;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * A request on the shared-link listener, split into link id, route and the remainder of the
 * path.
 *
 * @param rawRest   path after the route segment as the client sent it, starting with '/' or empty
 * @param statement SQL text for {@link ShareRoute#QUERY}, otherwise null
 */
record ShareRequest(HttpCall call, String shareId, ShareRoute route, String rawRest, String statement) {

    static ShareRequest parse(HttpCall call, ObjectMapper json) {
        String raw = call.rawPath();
        if (!raw.startsWith(SharedLinkManager.PUBLIC_PATH_PREFIX)) {
            throw new GatewayException(ErrorCode.LINK_NOT_FOUND, "not a shared-link path: " + call.path());
        }
        String tail = raw.substring(SharedLinkManager.PUBLIC_PATH_PREFIX.length());
        int slash = tail.indexOf('/');
        String shareId = decode(slash < 0 ? tail : tail.substring(0, slash));
        if (shareId.isBlank()) {
            throw new GatewayException(ErrorCode.LINK_NOT_FOUND, "shared-link id missing");
        }

        String after = slash < 0 ? "" : tail.substring(slash + 1);
        int next = after.indexOf('/');
        String segment = next < 0 ? after : after.substring(0, next);
        String rest = next < 0 ? "" : after.substring(next);
        ShareRoute route = ShareRoute.fromSegment(segment);
        if (route == null) {
            throw new MalformedRequestException("unknown shared-link route '" + segment + "'");
        }
        if ((route == ShareRoute.INFO || route == ShareRoute.DATA)
                && !"GET".equals(call.method()) && !"HEAD".equals(call.method())) {
            throw new MalformedRequestException(call.method() + " is not supported on this route");
        }
        String statement = route == ShareRoute.QUERY ? statement(call, json) : null;
        return new ShareRequest(call, shareId, route, rest, statement);
    }

    /** Object key or API sub-path, decoded. */
    String rest() {
        String r = rawRest.startsWith("/") ? rawRest.substring(1) : rawRest;
        return decode(r);
    }

    /** The document command in the body, as MongoDB extended JSON. */
    BsonDocument command() {
        String body = new String(call.body(), StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            throw new MalformedRequestException("command body is required");
        }
        BsonDocument doc;
        try {
            doc = BsonDocument.parse(body);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new MalformedRequestException("command body is not a JSON document", e);
        }
        if (doc.isEmpty()) {
            throw new MalformedRequestException("command body is an empty document");
        }
        return doc;
    }

    /** Database for a document command: the {@code db} parameter, then the command's {@code $db}. */
    String database(BsonDocument command) {
        String db = call.param("db");
        if (db != null && !db.isBlank()) return db;
        if (command.containsKey("$db") && command.get("$db").isString()) {
            return command.getString("$db").getValue();
        }
        return "test";
    }

    /** {@code {"query": "..."}} (or {@code "sql"}), else the body as plain text. */
    private static String statement(HttpCall call, ObjectMapper json) {
        String body = new String(call.body(), StandardCharsets.UTF_8).trim();
        if (body.startsWith("{")) {
            try {
                JsonNode node = json.readTree(body);
                JsonNode q = node.hasNonNull("query") ? node.get("query") : node.get("sql");
                return q == null || !q.isTextual() ? null : q.asText();
            } catch (IOException e) {
                // reported as a missing statement
                return null;
            }
        }
        if (body.isEmpty()) {
            return call.param("query");
        }
        return body;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}
