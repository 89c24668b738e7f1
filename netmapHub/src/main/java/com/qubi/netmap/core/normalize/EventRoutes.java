package com.qubi.netmap.core.normalize;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.qubi.netmap.core.model.EventKind;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routing table from push-stream event names to {@link EventKind}, loaded from YAML.
 *
 * <pre>
 * envelope:
 *   event_keys: [event, type]
 *   data_keys: [data, payload]
 * routes:
 *   - kind: SIGHTED
 *     events: [deviceFound, device.updated]
 * </pre>
 */
public class EventRoutes {
    public static final String DEFAULT_RESOURCE = "/event-routes.yml";

    private final Map<String, EventKind> byName;
    private final List<String> eventKeys;
    private final List<String> dataKeys;

    public EventRoutes(InputStream yaml) {
        try {
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            RouteConfig cfg = om.readValue(yaml, RouteConfig.class);
            this.byName = compile(cfg);
            this.eventKeys = cfg.envelope != null && cfg.envelope.event_keys != null
                    ? List.copyOf(cfg.envelope.event_keys) : List.of("event");
            this.dataKeys = cfg.envelope != null && cfg.envelope.data_keys != null
                    ? List.copyOf(cfg.envelope.data_keys) : List.of("data");
        } catch (Exception e) {
            throw new IllegalStateException("Error loading event routes", e);
        }
    }

    /** Routes bundled with the application. */
    public static EventRoutes defaults() {
        try (InputStream in = EventRoutes.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
            return new EventRoutes(in);
        } catch (IOException e) {
            throw new IllegalStateException("Error loading event routes", e);
        }
    }

    public Optional<EventKind> kindOf(String eventName) {
        if (eventName == null) return Optional.empty();
        return Optional.ofNullable(byName.get(eventName.trim()));
    }

    public List<String> eventKeys() { return eventKeys; }
    public List<String> dataKeys() { return dataKeys; }

    private static Map<String, EventKind> compile(RouteConfig cfg) {
        Map<String, EventKind> out = new HashMap<>();
        if (cfg == null || cfg.routes == null) return out;
        for (RouteConfig.Route r : cfg.routes) {
            if (r.kind == null || r.events == null) continue;
            EventKind kind = EventKind.valueOf(r.kind.trim().toUpperCase(Locale.ROOT));
            for (String name : r.events) {
                if (name != null && !name.isBlank()) out.put(name.trim(), kind);
            }
        }
        return out;
    }

    // ===== Config YAML =====

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RouteConfig {
        public Envelope envelope;
        public List<Route> routes = new ArrayList<>();

        @JsonIgnoreProperties(ignoreUnknown = true)
        public static final class Envelope {
            public List<String> event_keys;   // campo con el nombre del evento
            public List<String> data_keys;    // campo con el payload
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        public static final class Route {
            public String kind;               // SIGHTED | REMOVED | SNAPSHOT | METRICS
            public List<String> events;
        }
    }
}
