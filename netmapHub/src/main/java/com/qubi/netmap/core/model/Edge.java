package com.qubi.netmap.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Inferred, undirected connection. Bandwidth, latency and utilization are synthetic
 * ({@code derived} is always true), never measured.
 */
public record Edge(
        String id,              // par ordenado: "a<->b" con a <= b
        String source,
        String target,
        LinkType linkType,
        int bandwidthMbps,
        double latencyMs,
        double utilizationPct,
        boolean derived,
        EdgeStatus status
) {
    public static final String PAIR_SEPARATOR = "<->";

    /** Edge id for an unordered endpoint pair. */
    public static String idFor(String a, String b) {
        return a.compareTo(b) <= 0 ? a + PAIR_SEPARATOR + b : b + PAIR_SEPARATOR + a;
    }

    public boolean touches(String endpoint) {
        return source.equals(endpoint) || target.equals(endpoint);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == EdgeStatus.ACTIVE;
    }
}
