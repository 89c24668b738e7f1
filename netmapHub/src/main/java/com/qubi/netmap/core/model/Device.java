package com.qubi.netmap.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical device record, independent of the event source that produced it.
 * Instances are immutable; the store and the layout engine hand out modified copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Device {
    private final String id;              // id asignado por el servidor (puede faltar)
    private final String address;         // IPv4 textual, clave secundaria
    private final String displayName;
    private final DeviceKind kind;
    private final DeviceStatus status;
    private final Instant lastSeen;
    private final Map<String, Object> metrics;  // responseTime, vendor, mac...
    private final Position position;      // sólo lo asigna el LayoutEngine

    @JsonCreator
    private Device(
            @JsonProperty("id") String id,
            @JsonProperty("address") String address,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("kind") DeviceKind kind,
            @JsonProperty("status") DeviceStatus status,
            @JsonProperty("lastSeen") Instant lastSeen,
            @JsonProperty("metrics") Map<String, Object> metrics,
            @JsonProperty("position") Position position
    ) {
        this.id = id;
        this.address = address;
        this.displayName = displayName;
        this.kind = kind;
        this.status = status;
        this.lastSeen = lastSeen;
        this.metrics = (metrics == null || metrics.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.position = position;
    }

    // --- getters ---
    public String id() { return id; }
    public String address() { return address; }
    public String displayName() { return displayName; }
    public DeviceKind kind() { return kind; }
    public DeviceStatus status() { return status; }
    public Instant lastSeen() { return lastSeen; }
    public Map<String, Object> metrics() { return metrics; }
    public Position position() { return position; }

    /** The id when known, otherwise the address. */
    @JsonIgnore
    public String identityKey() {
        return id != null ? id : address;
    }

    @JsonIgnore
    public DeviceKind effectiveKind() {
        return kind != null ? kind : DeviceKind.UNKNOWN;
    }

    @JsonIgnore
    public boolean isOnline() {
        return status == DeviceStatus.ONLINE;
    }

    public Device withPosition(Position p) {
        return toBuilder().position(p).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).address(address).displayName(displayName)
                .kind(kind).status(status).lastSeen(lastSeen)
                .metrics(metrics).position(position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Device d)) return false;
        return Objects.equals(id, d.id)
                && Objects.equals(address, d.address)
                && Objects.equals(displayName, d.displayName)
                && kind == d.kind
                && status == d.status
                && Objects.equals(lastSeen, d.lastSeen)
                && metrics.equals(d.metrics)
                && Objects.equals(position, d.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, address, displayName, kind, status, lastSeen, metrics, position);
    }

    @Override
    public String toString() {
        return "Device{id=" + id + ", address=" + address + ", kind=" + kind + ", status=" + status + "}";
    }

    // --- builder ---
    public static Builder builder() { return new Builder(); }
    public static final class Builder {
        private String id;
        private String address;
        private String displayName;
        private DeviceKind kind;
        private DeviceStatus status;
        private Instant lastSeen;
        private Map<String, Object> metrics = new LinkedHashMap<>();
        private Position position;

        public Builder id(String id){ this.id = id; return this; }
        public Builder address(String a){ this.address = a; return this; }
        public Builder displayName(String n){ this.displayName = n; return this; }
        public Builder kind(DeviceKind k){ this.kind = k; return this; }
        public Builder status(DeviceStatus s){ this.status = s; return this; }
        public Builder lastSeen(Instant ts){ this.lastSeen = ts; return this; }
        public Builder metric(String k, Object v){ if (k != null && v != null) this.metrics.put(k, v); return this; }
        public Builder metrics(Map<String, Object> m){ this.metrics = new LinkedHashMap<>(); if (m != null) this.metrics.putAll(m); return this; }
        public Builder position(Position p){ this.position = p; return this; }

        public Device build() {
            return new Device(id, address, displayName, kind, status, lastSeen, metrics, position);
        }
    }
}
