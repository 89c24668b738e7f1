package com.qubi.netmap.core.model;

import java.util.HashSet;
import java.util.Set;

/**
 * Status/kind filter over a {@link TopologyView}. A null criterion matches everything.
 */
public record ViewFilter(
        DeviceStatus status,
        DeviceKind kind
) {
    public static final ViewFilter ALL = new ViewFilter(null, null);

    public boolean matches(Device d) {
        if (status != null && d.status() != status) return false;
        if (kind != null && d.effectiveKind() != kind) return false;
        return true;
    }

    public FilteredStats apply(TopologyView view) {
        Set<String> visibleKeys = new HashSet<>();
        int online = 0;
        int offline = 0;
        for (Device d : view.devices()) {
            if (!matches(d)) continue;
            visibleKeys.add(d.identityKey());
            if (d.status() == DeviceStatus.ONLINE) online++;
            else if (d.status() == DeviceStatus.OFFLINE) offline++;
        }
        int connections = 0;
        for (Edge e : view.edges()) {
            if (visibleKeys.contains(e.source()) && visibleKeys.contains(e.target())) connections++;
        }
        return new FilteredStats(visibleKeys.size(), view.devices().size(), online, offline, connections);
    }
}
