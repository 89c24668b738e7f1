package com.qubi.netmap.core.layout;

import com.qubi.netmap.core.model.Device;
import com.qubi.netmap.core.model.DeviceKind;
import com.qubi.netmap.core.model.Edge;
import com.qubi.netmap.core.model.Position;
import com.qubi.netmap.core.topology.Subnets;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assigns 2-D coordinates under a {@link LayoutStrategy}. The whole layout is recomputed on
 * every call; there is no incremental simulation. Randomness only comes from {@link Jitter},
 * so identical inputs always produce identical positions.
 */
public class LayoutEngine {
    public static final long DEFAULT_SEED = 0x5EEDL;

    private static final String OVERFLOW_ZONE = "*";

    private final Jitter jitter;

    public LayoutEngine() {
        this(new Jitter(DEFAULT_SEED));
    }

    public LayoutEngine(Jitter jitter) {
        this.jitter = jitter;
    }

    /**
     * @param edges current edge set; no strategy weighs connectivity yet
     * @return copies of {@code devices}, in the same order, with positions attached
     */
    public List<Device> position(List<Device> devices, List<Edge> edges, LayoutStrategy strategy, Bounds bounds) {
        int n = devices.size();
        if (n == 0) return List.of();
        Position[] placed = switch (strategy) {
            case HIERARCHICAL -> hierarchical(devices, bounds);
            case CIRCULAR -> circular(devices, bounds);
            case GRID -> grid(devices, bounds);
            case CLUSTERED -> clustered(devices, bounds);
        };
        List<Device> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Position p = placed[i];
            out.add(devices.get(i).withPosition(new Position(bounds.clampX(p.x()), bounds.clampY(p.y()))));
        }
        return out;
    }

    // ===== strategies =====

    private Position[] hierarchical(List<Device> devices, Bounds b) {
        List<List<Integer>> bands = new ArrayList<>();
        for (int i = 0; i < 4; i++) bands.add(new ArrayList<>());
        for (int i = 0; i < devices.size(); i++) {
            bands.get(band(devices.get(i).effectiveKind())).add(i);
        }
        bands.removeIf(List::isEmpty);

        Position[] out = new Position[devices.size()];
        double bandHeight = b.innerHeight() / bands.size();
        for (int row = 0; row < bands.size(); row++) {
            List<Integer> members = bands.get(row);
            double y = b.padding() + (row + 0.5) * bandHeight;
            double step = b.innerWidth() / (members.size() + 1);
            for (int k = 0; k < members.size(); k++) {
                out[members.get(k)] = new Position(b.padding() + (k + 1) * step, y);
            }
        }
        return out;
    }

    static int band(DeviceKind kind) {
        return switch (kind) {
            case ROUTER -> 0;
            case SWITCH -> 1;
            case SERVER -> 2;
            default -> 3;
        };
    }

    private Position[] circular(List<Device> devices, Bounds b) {
        int n = devices.size();
        double radius = Math.min(b.width(), b.height()) / 3;
        Position[] out = new Position[n];
        for (int i = 0; i < n; i++) {
            double angle = 2 * Math.PI * i / n;
            out[i] = new Position(b.centerX() + radius * Math.cos(angle), b.centerY() + radius * Math.sin(angle));
        }
        return out;
    }

    private Position[] grid(List<Device> devices, Bounds b) {
        int n = devices.size();
        int cols = (int) Math.ceil(Math.sqrt(n));
        int rows = (int) Math.ceil((double) n / cols);
        double cellW = b.innerWidth() / cols;
        double cellH = b.innerHeight() / rows;
        Position[] out = new Position[n];
        for (int i = 0; i < n; i++) {
            int r = i / cols;
            int c = i % cols;
            out[i] = new Position(b.padding() + (c + 0.5) * cellW, b.padding() + (r + 0.5) * cellH);
        }
        return out;
    }

    /*
     * Routers anchor zones on an inner ring (or the centre when alone). Subnets without a
     * router, and devices without a usable address, get zones on an outer ring. Members sit
     * on a small ring around their zone centre, nudged by the jitter source.
     */
    private Position[] clustered(List<Device> devices, Bounds b) {
        int n = devices.size();
        double span = Math.min(b.innerWidth(), b.innerHeight());

        List<Integer> routers = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (devices.get(i).effectiveKind() == DeviceKind.ROUTER) routers.add(i);
        }
        routers.sort(Comparator.comparing((Integer i) -> devices.get(i).identityKey()));

        Map<String, Position> zoneCenter = new LinkedHashMap<>();
        Map<String, String> subnetZone = new TreeMap<>();
        for (int k = 0; k < routers.size(); k++) {
            Device r = devices.get(routers.get(k));
            Position c = routers.size() == 1
                    ? new Position(b.centerX(), b.centerY())
                    : ring(b, span / 6, k, routers.size(), 0);
            zoneCenter.put(r.identityKey(), c);
            String subnet = Subnets.groupKey(r.address());
            if (subnet != null) subnetZone.putIfAbsent(subnet, r.identityKey());
        }

        Map<String, List<Integer>> zoneMembers = new LinkedHashMap<>();
        Map<String, List<Integer>> orphanZones = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            Device d = devices.get(i);
            if (d.effectiveKind() == DeviceKind.ROUTER) continue;
            String subnet = Subnets.groupKey(d.address());
            String zone = subnet == null ? OVERFLOW_ZONE : subnetZone.get(subnet);
            if (zone != null && zoneCenter.containsKey(zone)) {
                zoneMembers.computeIfAbsent(zone, z -> new ArrayList<>()).add(i);
            } else {
                orphanZones.computeIfAbsent(zone == null ? subnet : zone, z -> new ArrayList<>()).add(i);
            }
        }
        int outer = 0;
        for (Map.Entry<String, List<Integer>> en : orphanZones.entrySet()) {
            zoneCenter.put(en.getKey(), ring(b, span / 3, outer++, orphanZones.size(), Math.PI / orphanZones.size()));
            zoneMembers.put(en.getKey(), en.getValue());
        }

        Position[] out = new Position[n];
        for (Integer i : routers) {
            out[i] = zoneCenter.get(devices.get(i).identityKey());
        }
        double memberRadius = span / 10;
        for (Map.Entry<String, List<Integer>> en : zoneMembers.entrySet()) {
            Position c = zoneCenter.get(en.getKey());
            List<Integer> members = en.getValue();
            for (int k = 0; k < members.size(); k++) {
                Device d = devices.get(members.get(k));
                Position base = ring(c, memberRadius, k, members.size(), 0);
                double[] off = jitter.offset(d.identityKey(), memberRadius / 4);
                out[members.get(k)] = new Position(base.x() + off[0], base.y() + off[1]);
            }
        }
        return out;
    }

    private static Position ring(Bounds b, double radius, int k, int count, double phase) {
        return ring(new Position(b.centerX(), b.centerY()), radius, k, count, phase);
    }

    private static Position ring(Position center, double radius, int k, int count, double phase) {
        double angle = phase + 2 * Math.PI * k / count;
        return new Position(center.x() + radius * Math.cos(angle), center.y() + radius * Math.sin(angle));
    }
}
