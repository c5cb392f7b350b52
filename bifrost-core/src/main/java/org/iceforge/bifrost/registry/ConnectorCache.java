package org.iceforge.bifrost.registry;

import org.iceforge.bifrost.model.ProxyConnector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** TTL cache of connector rows, addressable by id and by access token. */
final class ConnectorCache {

    private record Entry(ProxyConnector value, Instant expiresAt) {}

    private final ConcurrentHashMap<String, Entry> byId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Entry> byToken = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    ConnectorCache(Clock clock, Duration ttl) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.ttl = (ttl == null || ttl.isNegative()) ? Duration.ofSeconds(30) : ttl;
    }

    Optional<ProxyConnector> byId(String id) {
        return get(byId, id);
    }

    Optional<ProxyConnector> byToken(String token) {
        return get(byToken, token);
    }

    void put(ProxyConnector c) {
        if (c == null || ttl.isZero()) return;
        Entry e = new Entry(c, clock.instant().plus(ttl));
        byId.put(c.id(), e);
        byToken.put(c.accessToken(), e);
    }

    void invalidate(ProxyConnector c) {
        if (c == null) return;
        byId.remove(c.id());
        byToken.remove(c.accessToken());
    }

    void clear() {
        byId.clear();
        byToken.clear();
    }

    private Optional<ProxyConnector> get(ConcurrentHashMap<String, Entry> map, String key) {
        if (key == null) return Optional.empty();
        Entry e = map.get(key);
        if (e == null) return Optional.empty();
        if (clock.instant().isAfter(e.expiresAt())) {
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value());
    }
}
