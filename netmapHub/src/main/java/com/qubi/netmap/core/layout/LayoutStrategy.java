package com.qubi.netmap.core.layout;

import java.util.Locale;

public enum LayoutStrategy {
    HIERARCHICAL,
    CIRCULAR,
    GRID,
    CLUSTERED;

    public static LayoutStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return HIERARCHICAL;
        }
        String v = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (LayoutStrategy s : values()) {
            if (s.name().equals(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown layout strategy: " + raw);
    }
}
