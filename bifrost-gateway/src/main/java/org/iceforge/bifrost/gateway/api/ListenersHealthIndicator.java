package org.iceforge.bifrost.gateway.api;

import org.iceforge.bifrost.gateway.listener.ListenerLifecycle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Down when an enabled listener failed to bind. Disabled listeners do not count.
 */
@Component("listeners")
public class ListenersHealthIndicator implements HealthIndicator {

    private final ListenerLifecycle listeners;

    public ListenersHealthIndicator(ListenerLifecycle listeners) {
        this.listeners = listeners;
    }

    @Override
    public Health health() {
        List<ListenerLifecycle.Status> statuses = listeners.statuses();
        boolean failed = statuses.stream().anyMatch(s -> s.state() == ListenerLifecycle.State.FAILED);
        Health.Builder b = failed ? Health.down() : Health.up();
        for (ListenerLifecycle.Status s : statuses) {
            b.withDetail(s.protocol().id(), ListenerController.toMap(s));
        }
        return b.build();
    }
}
