package com.qubi.netmap.core.topology;

import com.qubi.netmap.core.model.Device;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dotted-quad helpers and /24-style grouping (first three octets).
 */
public final class Subnets {
    private Subnets() {}

    /** The four octets, or null when the address is not a well-formed IPv4 dotted quad. */
    public static int[] octets(String address) {
        if (address == null) return null;
        String[] parts = address.trim().split("\\.", -1);
        if (parts.length != 4) return null;
        int[] out = new int[4];
        for (int i = 0; i < 4; i++) {
            String p = parts[i];
            if (p.isEmpty() || p.length() > 3) return null;
            for (int c = 0; c < p.length(); c++) {
                char ch = p.charAt(c);
                if (ch < '0' || ch > '9') return null;
            }
            int v = Integer.parseInt(p);
            if (v > 255) return null;
            out[i] = v;
        }
        return out;
    }

    /** "a.b.c" for a well-formed address, else null. */
    public static String groupKey(String address) {
        int[] o = octets(address);
        if (o == null) return null;
        return o[0] + "." + o[1] + "." + o[2];
    }

    public static int lastOctet(String address) {
        int[] o = octets(address);
        return o == null ? -1 : o[3];
    }

    /**
     * Groups by subnet key, ordered by key. Devices without a usable address are left out.
     * Members keep their input order.
     */
    public static Map<String, List<Device>> group(Collection<Device> devices) {
        Map<String, List<Device>> out = new TreeMap<>();
        for (Device d : devices) {
            String key = groupKey(d.address());
            if (key == null) continue;
            out.computeIfAbsent(key, k -> new ArrayList<>()).add(d);
        }
        return out;
    }
}
