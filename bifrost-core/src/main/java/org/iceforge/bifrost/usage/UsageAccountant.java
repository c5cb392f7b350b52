package org.iceforge.bifrost.usage;

import org.iceforge.bifrost.audit.AccessEvent;
import org.iceforge.bifrost.audit.AuditSink;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.store.SharedLinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Counts usage. Durable counters are changed with single atomic statements in the store;
 * outcomes feed the in-memory stats and the audit sink.
 */
public class UsageAccountant {
    private static final Logger log = LoggerFactory.getLogger(UsageAccountant.class);

    private final ConnectorRegistry registry;
    private final SharedLinkStore links;
    private final AuditSink audit;
    private final Clock clock;
    private final UsageStats stats = new UsageStats();

    public UsageAccountant(ConnectorRegistry registry, SharedLinkStore links, AuditSink audit, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.links = Objects.requireNonNull(links, "links");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Bumps the connector's request counter. False means the connector was revoked meanwhile. */
    public boolean recordAttempt(String connectorId) {
        return registry.recordRequest(connectorId, clock.instant());
    }

    /** Consumes one use of a link if it still has one. */
    public boolean tryConsume(String shareId) {
        return links.tryConsume(shareId, clock.instant());
    }

    public void recordOutcome(AccessEvent event) {
        String id = event.subjectId();
        if (id != null) {
            UsageStats.Counters c = stats.counters(id);
            switch (event.outcome()) {
                case SUCCEEDED -> c.succeeded.increment();
                case REJECTED -> c.rejected.increment();
                case FAILED -> c.failed.increment();
            }
            if (event.bytes() > 0) c.bytes.add(event.bytes());
            c.latencyMillis.add(event.latencyMillis());
            c.lastAccess = event.timestamp();
        }
        try {
            audit.append(event);
        } catch (RuntimeException e) {
            log.warn("Audit sink rejected event for {}: {}", id, e.toString());
        }
    }

    public UsageStats stats() {
        return stats;
    }
}
