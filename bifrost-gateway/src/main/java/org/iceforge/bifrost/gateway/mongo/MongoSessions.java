package org.iceforge.bifrost.gateway.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Backend sessions of one client connection, one per connector. Cursors opened by a command
 * can only be continued in the session that opened them.
 */
public final class MongoSessions implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MongoSessions.class);

    private final Map<String, ClientSession> sessions = new HashMap<>();

    synchronized ClientSession get(String connectorId, MongoClient client) {
        ClientSession s = sessions.get(connectorId);
        if (s == null || s.getOriginator() != client) {
            if (s != null) closeQuietly(s);
            s = client.startSession();
            sessions.put(connectorId, s);
        }
        return s;
    }

    @Override
    public synchronized void close() {
        sessions.values().forEach(MongoSessions::closeQuietly);
        sessions.clear();
    }

    private static void closeQuietly(ClientSession s) {
        try {
            s.close();
        } catch (RuntimeException e) {
            log.debug("Closing backend session failed: {}", e.toString());
        }
    }
}
