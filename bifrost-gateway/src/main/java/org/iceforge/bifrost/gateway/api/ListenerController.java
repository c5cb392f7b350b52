package org.iceforge.bifrost.gateway.api;

import org.iceforge.bifrost.gateway.listener.ListenerLifecycle;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** State of every protocol listener. */
@RestController
@RequestMapping("/api")
public class ListenerController {

    private final ListenerLifecycle listeners;

    public ListenerController(ListenerLifecycle listeners) {
        this.listeners = Objects.requireNonNull(listeners);
    }

    @GetMapping("/listeners")
    public List<Map<String, Object>> listeners() {
        return listeners.statuses().stream().map(ListenerController::toMap).toList();
    }

    static Map<String, Object> toMap(ListenerLifecycle.Status s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("proxy_type", s.protocol().id());
        m.put("state", s.state().name().toLowerCase(Locale.ROOT));
        m.put("host", s.host());
        m.put("port", s.port());
        m.put("active_sessions", s.activeSessions());
        if (s.error() != null) {
            m.put("error", s.error());
        }
        return m;
    }
}
