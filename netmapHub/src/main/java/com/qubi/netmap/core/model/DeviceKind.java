package com.qubi.netmap.core.model;

import java.util.Locale;

public enum DeviceKind {
    ROUTER("router", 1000),
    SWITCH("switch", 1000),
    SERVER("server", 100),
    WORKSTATION("workstation", 100),
    UNKNOWN("unknown", 10);

    private final String wireName;
    private final int capacityMbps;   // techo sintético de ancho de banda

    DeviceKind(String wireName, int capacityMbps) {
        this.wireName = wireName;
        this.capacityMbps = capacityMbps;
    }

    public int capacityMbps() {
        return capacityMbps;
    }

    /** Lenient parse: null for absent input, UNKNOWN for anything unrecognized. */
    public static DeviceKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (DeviceKind kind : values()) {
            if (kind.wireName.equals(v)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
