package com.qubi.netmap.core.model;

import java.util.Locale;

public enum DeviceStatus {
    ONLINE,
    OFFLINE,
    UNKNOWN;

    /**
     * Maps a reported status or state. {@code up}/{@code online} and {@code down}/{@code offline}
     * are recognized in any case; any other non-blank value is UNKNOWN, blank input is null.
     */
    public static DeviceStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "online", "up" -> ONLINE;
            case "offline", "down" -> OFFLINE;
            default -> UNKNOWN;
        };
    }
}
