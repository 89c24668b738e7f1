package com.qubi.netmap.core.topology;

import com.qubi.netmap.core.model.Device;
import com.qubi.netmap.core.model.DeviceKind;
import com.qubi.netmap.core.model.Edge;
import com.qubi.netmap.core.model.EdgeStatus;
import com.qubi.netmap.core.model.LinkType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthesizes connectivity from address structure. Devices never report their neighbours,
 * so links are guessed per subnet group (first three octets):
 * <ul>
 *   <li>a group with a gateway becomes a star around it ({@link LinkType#GATEWAY});</li>
 *   <li>a gateway-less group of at most {@code meshLimit} members becomes a full mesh
 *       ({@link LinkType#MESH});</li>
 *   <li>larger gateway-less groups get no edges at all.</li>
 * </ul>
 * The gateway is a router, or a device whose last octet is 1 or 254. Routers win over
 * non-routers, and within each class the lexicographically smallest address wins.
 *
 * <p>Pure and deterministic: the same device set always yields the same edges, whatever
 * the input order.
 */
public class TopologyInferencer {
    public static final int DEFAULT_MESH_LIMIT = 4;

    private static final Comparator<Device> BY_ADDRESS =
            Comparator.comparing(Device::address).thenComparing(Device::identityKey);

    private final int meshLimit;
    private final boolean backboneLinks;

    public TopologyInferencer() {
        this(DEFAULT_MESH_LIMIT, false);
    }

    /**
     * @param meshLimit largest gateway-less group that still gets a full mesh
     * @param backboneLinks also chain router gateways of different subnets, in address order
     */
    public TopologyInferencer(int meshLimit, boolean backboneLinks) {
        this.meshLimit = meshLimit;
        this.backboneLinks = backboneLinks;
    }

    public List<Edge> infer(List<Device> devices) {
        Map<String, Edge> edges = new LinkedHashMap<>();
        List<Device> routerGateways = new ArrayList<>();

        for (List<Device> group : Subnets.group(devices).values()) {
            List<Device> members = new ArrayList<>(group);
            members.sort(BY_ADDRESS);

            Device gateway = findGateway(members);
            if (gateway != null && gateway.effectiveKind() == DeviceKind.ROUTER) {
                routerGateways.add(gateway);
            }
            if (members.size() < 2) continue;

            if (gateway != null) {
                for (Device m : members) {
                    if (m != gateway) add(edges, gateway, m, LinkType.GATEWAY);
                }
            } else if (members.size() <= meshLimit) {
                for (int i = 0; i < members.size(); i++) {
                    for (int j = i + 1; j < members.size(); j++) {
                        add(edges, members.get(i), members.get(j), LinkType.MESH);
                    }
                }
            }
            // grupo grande sin gateway: ambiguo, no se infieren enlaces
        }

        if (backboneLinks && routerGateways.size() > 1) {
            routerGateways.sort(BY_ADDRESS);
            for (int i = 1; i < routerGateways.size(); i++) {
                add(edges, routerGateways.get(i - 1), routerGateways.get(i), LinkType.BACKBONE);
            }
        }
        return List.copyOf(edges.values());
    }

    /** Members must already be sorted by address. */
    static Device findGateway(List<Device> members) {
        Device candidate = null;
        for (Device d : members) {
            if (d.effectiveKind() == DeviceKind.ROUTER) return d;
            if (candidate == null && isGatewayAddress(d.address())) candidate = d;
        }
        return candidate;
    }

    static boolean isGatewayAddress(String address) {
        int last = Subnets.lastOctet(address);
        return last == 1 || last == 254;
    }

    private static void add(Map<String, Edge> edges, Device source, Device target, LinkType type) {
        String s = source.identityKey();
        String t = target.identityKey();
        if (s.equals(t)) return;
        String id = Edge.idFor(s, t);
        if (edges.containsKey(id)) return;
        int bandwidth = Math.min(source.effectiveKind().capacityMbps(), target.effectiveKind().capacityMbps());
        EdgeStatus status = source.isOnline() && target.isOnline() ? EdgeStatus.ACTIVE : EdgeStatus.INACTIVE;
        edges.put(id, new Edge(id, s, t, type, bandwidth,
                SyntheticLinkMetrics.latencyMs(id, type),
                SyntheticLinkMetrics.utilizationPct(id, type),
                true, status));
    }
}
