package com.qubi.netmap.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Decoded push-stream or pull payload. Each variant maps to one store operation.
 */
public interface DeviceEvent {

    EventKind kind();

    record Sighted(Device device) implements DeviceEvent {
        @Override public EventKind kind() { return EventKind.SIGHTED; }
    }

    record Removed(String id) implements DeviceEvent {
        @Override public EventKind kind() { return EventKind.REMOVED; }
    }

    record Snapshot(List<Device> devices) implements DeviceEvent {
        public Snapshot {
            devices = List.copyOf(devices);
        }
        @Override public EventKind kind() { return EventKind.SNAPSHOT; }
    }

    record Metrics(String deviceId, Map<String, Object> metrics, Instant lastSeen) implements DeviceEvent {
        public Metrics {
            metrics = (metrics == null) ? Map.of() : Map.copyOf(metrics);
        }
        @Override public EventKind kind() { return EventKind.METRICS; }
    }
}
