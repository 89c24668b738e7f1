package com.qubi.netmap.core.model;

import com.qubi.netmap.core.layout.LayoutStrategy;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot handed to consumers after every mutation batch.
 */
public record TopologyView(
        List<Device> devices,          // con posición asignada
        List<Edge> edges,
        AggregateCounters counters,
        ConnectionState connectionState,
        boolean pullFailing,
        LayoutStrategy strategy,
        long version,                  // versión del store al momento del cálculo
        Instant updatedAt
) {
    public TopologyView {
        devices = List.copyOf(devices);
        edges = List.copyOf(edges);
    }

    public static TopologyView empty(LayoutStrategy strategy) {
        return new TopologyView(List.of(), List.of(), AggregateCounters.EMPTY,
                ConnectionState.DISCONNECTED, false, strategy, 0L, Instant.now());
    }

    public TopologyView withConnectionState(ConnectionState state) {
        return new TopologyView(devices, edges, counters, state, pullFailing, strategy, version, Instant.now());
    }

    public TopologyView withPullFailing(boolean failing) {
        return new TopologyView(devices, edges, counters, connectionState, failing, strategy, version, Instant.now());
    }
}
