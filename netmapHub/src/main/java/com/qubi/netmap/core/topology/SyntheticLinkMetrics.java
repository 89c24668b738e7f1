package com.qubi.netmap.core.topology;

import com.qubi.netmap.core.model.LinkType;

import java.util.SplittableRandom;

/**
 * Simulated latency and utilization for inferred links. Values are derived from the edge id,
 * so the same edge always gets the same numbers.
 */
final class SyntheticLinkMetrics {
    private SyntheticLinkMetrics() {}

    static double latencyMs(String edgeId, LinkType type) {
        double span = switch (type) {
            case MESH -> 5.0;
            case BACKBONE -> 2.0;
            default -> 10.0;
        };
        return round(1.0 + rnd(edgeId, 0x1A7E).nextDouble() * span);
    }

    static double utilizationPct(String edgeId, LinkType type) {
        double ceiling = type == LinkType.MESH ? 50.0 : 100.0;
        return round(rnd(edgeId, 0x07111).nextDouble() * ceiling);
    }

    private static SplittableRandom rnd(String edgeId, long salt) {
        return new SplittableRandom(edgeId.hashCode() * 31L + salt);
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
