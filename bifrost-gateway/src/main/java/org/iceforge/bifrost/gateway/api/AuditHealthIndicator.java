package org.iceforge.bifrost.gateway.api;

import org.iceforge.bifrost.audit.JdbcAccessLogSink;
import org.iceforge.bifrost.audit.LoggingAlertSink;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Access-log writer backlog and raised alerts. Down once access-log rows have been dropped
 * or failed to write.
 */
@Component("audit")
public class AuditHealthIndicator implements HealthIndicator {

    private final JdbcAccessLogSink accessLog;
    private final LoggingAlertSink alerts;

    public AuditHealthIndicator(JdbcAccessLogSink accessLog, LoggingAlertSink alerts) {
        this.accessLog = accessLog;
        this.alerts = alerts;
    }

    @Override
    public Health health() {
        long dropped = accessLog.droppedEvents();
        long writeErrors = accessLog.writeErrorCount();
        Health.Builder b = dropped == 0 && writeErrors == 0 ? Health.up() : Health.down();
        return b.withDetail("accessLogDropped", dropped)
                .withDetail("accessLogWriteErrors", writeErrors)
                .withDetail("alertsRaised", alerts.raisedCount())
                .build();
    }
}
