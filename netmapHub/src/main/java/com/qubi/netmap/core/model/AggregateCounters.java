package com.qubi.netmap.core.model;

import java.util.Collection;

public record AggregateCounters(
        int totalDevices,
        int onlineDevices,
        int offlineDevices,
        int activeEdges
) {
    public static final AggregateCounters EMPTY = new AggregateCounters(0, 0, 0, 0);

    public static AggregateCounters of(Collection<Device> devices, Collection<Edge> edges) {
        int online = 0;
        int offline = 0;
        for (Device d : devices) {
            if (d.status() == DeviceStatus.ONLINE) online++;
            else if (d.status() == DeviceStatus.OFFLINE) offline++;
        }
        int active = 0;
        if (edges != null) {
            for (Edge e : edges) if (e.isActive()) active++;
        }
        return new AggregateCounters(devices.size(), online, offline, active);
    }
}
